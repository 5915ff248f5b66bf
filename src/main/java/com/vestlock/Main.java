package com.vestlock;

import com.vestlock.adapter.in.web.HttpServerVerticle;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Time Lock Ledger...");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        // Precedence: system properties > environment > application.yml
        ConfigRetriever retriever = ConfigRetriever.create(vertx, configOptions());

        retriever.getConfig()
                .compose(config -> {
                    log.info("Loaded configuration from application.yml");
                    return vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                            .setConfig(config)
                            .setInstances(1));
                })
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Time Lock Ledger...");
                        vertx.close();
                    }));

                    log.info("Time Lock Ledger is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to start Time Lock Ledger", error);
                    vertx.close();
                });
    }

    static ConfigRetrieverOptions configOptions() {
        ConfigStoreOptions fileStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", "application.yml"));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
                .setType("env")
                .setConfig(new JsonObject().put("raw-data", true));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
                .setType("sys")
                .setConfig(new JsonObject().put("cache", false));

        return new ConfigRetrieverOptions()
                .addStore(fileStore)
                .addStore(envStore)
                .addStore(sysPropsStore);
    }
}
