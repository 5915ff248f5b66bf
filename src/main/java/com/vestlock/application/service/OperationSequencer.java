package com.vestlock.application.service;

import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.function.Supplier;

/**
 * Runs asynchronous operations strictly one after another.
 * An operation submitted while another is in flight (including from inside it)
 * starts only once the running one has completed. Operations must not wait on
 * the futures of operations they submit themselves.
 */
public class OperationSequencer {

    private Future<Void> tail = Future.succeededFuture();

    public synchronized <T> Future<T> submit(Supplier<Future<T>> operation) {
        Promise<Void> done = Promise.promise();
        Future<Void> previous = tail;
        tail = done.future();

        return previous.compose(v -> {
            Future<T> result = invoke(operation);
            result.onComplete(ar -> done.complete());
            return result;
        });
    }

    private static <T> Future<T> invoke(Supplier<Future<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
