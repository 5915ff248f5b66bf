package com.vestlock.adapter.out.eventbus;

import com.vestlock.application.port.out.LockEventPublisher;
import com.vestlock.domain.event.LockEvent;
import io.vertx.core.eventbus.EventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes lock events on the Vert.x event bus
 * Requires LockEventCodec to be registered as default codec for LockEvent
 */
@Slf4j
@RequiredArgsConstructor
public class EventBusLockEventPublisher implements LockEventPublisher {

    public static final String ADDRESS = "lock.events";

    private final EventBus eventBus;

    @Override
    public void publish(LockEvent event) {
        eventBus.publish(ADDRESS, event);
        log.debug("Published {} event for lock {}", event.getType(), event.getLockId());
    }
}
