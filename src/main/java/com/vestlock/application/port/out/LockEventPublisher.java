package com.vestlock.application.port.out;

import com.vestlock.domain.event.LockEvent;

/**
 * Output port for lock lifecycle notifications (fire-and-forget)
 */
public interface LockEventPublisher {

    void publish(LockEvent event);
}
