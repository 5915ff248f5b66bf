package com.vestlock.adapter.in.web;

import com.vestlock.adapter.in.web.custody.CustodyAccountHandler;
import com.vestlock.adapter.in.web.deposit.DepositHandler;
import com.vestlock.adapter.in.web.lockquery.LockQueryHandler;
import com.vestlock.adapter.in.web.solvency.SolvencyHandler;
import com.vestlock.adapter.in.web.withdraw.WithdrawHandler;
import com.vestlock.adapter.out.custody.InMemoryCustodyAdapter;
import com.vestlock.adapter.out.eventbus.EventBusLockEventPublisher;
import com.vestlock.adapter.out.eventbus.LockEventCodec;
import com.vestlock.adapter.out.persistence.InMemoryLockPersistenceAdapter;
import com.vestlock.adapter.out.persistence.JdbcLockPersistenceAdapter;
import com.vestlock.adapter.out.registry.InMemoryPositionRegistryAdapter;
import com.vestlock.application.port.in.LockQueryUseCase;
import com.vestlock.application.port.in.SolvencyAuditUseCase;
import com.vestlock.application.port.out.LockEventPublisher;
import com.vestlock.application.port.out.LockRepository;
import com.vestlock.application.port.out.OwnershipRegistry;
import com.vestlock.application.service.ContentHashLockIdDeriver;
import com.vestlock.application.service.DepositValidator;
import com.vestlock.application.service.LockIdDeriver;
import com.vestlock.application.service.LockLifecycleService;
import com.vestlock.application.service.LockQueryService;
import com.vestlock.application.service.SequentialLockIdDeriver;
import com.vestlock.application.service.SolvencyAuditService;
import com.vestlock.domain.event.LockEvent;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.infrastructure.config.LedgerConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private final Clock clock;

    private LedgerConfig ledgerConfig;
    private JDBCPool jdbcPool;
    private LockRepository lockRepository;
    private HttpServer httpServer;
    private SolvencyAuditUseCase solvencyAuditUseCase;

    private DepositHandler depositHandler;
    private WithdrawHandler withdrawHandler;
    private LockQueryHandler lockQueryHandler;
    private SolvencyHandler solvencyHandler;
    private CustodyAccountHandler custodyAccountHandler;

    public HttpServerVerticle() {
        this(Clock.systemUTC());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        loadConfig()
                .compose(v -> initializeStore())
                .compose(v -> {
                    log.info("Lock store initialized ({})", ledgerConfig.store());
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (solvencyAuditUseCase != null) {
            solvencyAuditUseCase.stopPeriodicAudit();
        }
        if (jdbcPool != null) {
            jdbcPool.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to (differs from the configured one when configured as 0 in tests)
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : ledgerConfig.httpPort();
    }

    private Future<Void> loadConfig() {
        try {
            ledgerConfig = LedgerConfig.from(config());
            return Future.succeededFuture();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }

    private Future<Void> initializeStore() {
        if (ledgerConfig.store() == LedgerConfig.StoreType.MEMORY) {
            lockRepository = new InMemoryLockPersistenceAdapter();
            return Future.succeededFuture();
        }

        JsonObject dbConfig = ledgerConfig.database();
        log.info("Connecting to database: {}", dbConfig.getString("url"));

        JsonObject poolConfig = new JsonObject()
                .put("url", dbConfig.getString("url"))
                .put("user", dbConfig.getString("user"))
                .put("password", dbConfig.getString("password"))
                .put("driver_class", dbConfig.getString("driver_class"))
                .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

        jdbcPool = JDBCPool.pool(vertx, poolConfig);
        JdbcLockPersistenceAdapter jdbcAdapter = new JdbcLockPersistenceAdapter(jdbcPool);
        lockRepository = jdbcAdapter;

        return jdbcAdapter.initializeSchema()
                .onFailure(error -> log.error("Database initialization failed", error));
    }

    private Future<Void> initializeServices() {
        registerEventCodec();

        // Output ports (adapters)
        InMemoryCustodyAdapter custody = new InMemoryCustodyAdapter();
        OwnershipRegistry ownershipRegistry = ledgerConfig.usesRegistry()
                ? new InMemoryPositionRegistryAdapter()
                : null;
        LockEventPublisher eventPublisher = new EventBusLockEventPublisher(vertx.eventBus());
        LockIdDeriver idDeriver = ledgerConfig.idStrategy() == LedgerConfig.IdStrategy.SEQUENTIAL
                ? new SequentialLockIdDeriver(lockRepository, ledgerConfig.idOrigin())
                : new ContentHashLockIdDeriver(lockRepository);

        // Application services (use cases)
        LockLifecycleService lifecycleService = new LockLifecycleService(
                new DepositValidator(),
                lockRepository,
                idDeriver,
                custody,
                ownershipRegistry,
                eventPublisher,
                clock
        );
        LockQueryUseCase lockQueryUseCase = new LockQueryService(lockRepository, ownershipRegistry, clock);
        solvencyAuditUseCase = new SolvencyAuditService(vertx, lockRepository, custody);

        // Input adapters (handlers)
        depositHandler = new DepositHandler(lifecycleService);
        withdrawHandler = new WithdrawHandler(lifecycleService);
        lockQueryHandler = new LockQueryHandler(lockQueryUseCase);
        solvencyHandler = new SolvencyHandler(solvencyAuditUseCase);
        custodyAccountHandler = new CustodyAccountHandler(custody);

        log.info("Services wired up (ids: {}, ownership: {})", ledgerConfig.idStrategy(), ledgerConfig.ownership());

        return restoreCustody(custody)
                .compose(v -> idDeriver.initialize())
                .onSuccess(v -> solvencyAuditUseCase.startPeriodicAudit(ledgerConfig.auditIntervalMs()));
    }

    /**
     * The simulated custody starts empty, while a JDBC store keeps its locks across restarts.
     * Custody for every stored ACTIVE lock is put back before any withdrawal can run.
     */
    private Future<Void> restoreCustody(InMemoryCustodyAdapter custody) {
        return lockRepository.lockedAssets()
                .compose(assets -> {
                    Future<Void> future = Future.succeededFuture();
                    for (AssetRef asset : assets) {
                        future = future.compose(v -> lockRepository.totalLocked(asset)
                                .onSuccess(total -> custody.restoreCustody(asset, total))
                                .mapEmpty());
                    }
                    return future;
                });
    }

    private void registerEventCodec() {
        try {
            vertx.eventBus().registerDefaultCodec(LockEvent.class, new LockEventCodec());
            log.info("Registered LockEvent message codec");
        } catch (IllegalStateException e) {
            log.debug("LockEvent codec already registered: {}", e.getMessage());
        }
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        WebRouter webRouter = new WebRouter(router, depositHandler, withdrawHandler,
                lockQueryHandler, solvencyHandler, custodyAccountHandler);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ApiErrorResponse.send(ctx, 404, "Endpoint not found"));

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(ledgerConfig.httpPort())
                .onSuccess(server -> {
                    httpServer = server;
                    log.info("HTTP server listening on port {}", server.actualPort());
                })
                .mapEmpty();
    }
}
