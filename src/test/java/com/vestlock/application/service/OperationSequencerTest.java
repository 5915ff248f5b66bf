package com.vestlock.application.service;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.vestlock.testsupport.Futures.await;
import static com.vestlock.testsupport.Futures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OperationSequencer
 */
class OperationSequencerTest {

    @Test
    void submit_shouldNotStartSecondOperationBeforeFirstCompletes() throws Exception {
        OperationSequencer sequencer = new OperationSequencer();
        List<String> trace = new ArrayList<>();
        Promise<String> first = Promise.promise();

        Future<String> firstResult = sequencer.submit(() -> {
            trace.add("first started");
            return first.future();
        });
        Future<String> secondResult = sequencer.submit(() -> {
            trace.add("second started");
            return Future.succeededFuture("second");
        });

        assertEquals(List.of("first started"), trace);
        assertFalse(secondResult.isComplete());

        first.complete("first");

        assertEquals("first", await(firstResult));
        assertEquals("second", await(secondResult));
        assertEquals(List.of("first started", "second started"), trace);
    }

    @Test
    void submit_nestedCall_shouldRunAfterEnclosingOperation() throws Exception {
        OperationSequencer sequencer = new OperationSequencer();
        List<String> trace = new ArrayList<>();
        List<Future<String>> nested = new ArrayList<>();

        Future<String> outer = sequencer.submit(() -> {
            trace.add("outer started");
            nested.add(sequencer.submit(() -> {
                trace.add("nested started");
                return Future.succeededFuture("nested");
            }));
            trace.add("outer finished");
            return Future.succeededFuture("outer");
        });

        assertEquals("outer", await(outer));
        assertEquals("nested", await(nested.get(0)));
        assertEquals(List.of("outer started", "outer finished", "nested started"), trace);
    }

    @Test
    void submit_failedOperation_shouldNotBlockQueue() throws Exception {
        OperationSequencer sequencer = new OperationSequencer();

        Future<String> failing = sequencer.submit(() -> Future.failedFuture("boom"));
        Future<String> next = sequencer.submit(() -> Future.succeededFuture("ok"));

        assertEquals("boom", awaitFailure(failing).getMessage());
        assertEquals("ok", await(next));
    }

    @Test
    void submit_throwingOperation_shouldFailFutureAndNotBlockQueue() throws Exception {
        OperationSequencer sequencer = new OperationSequencer();

        Future<String> throwing = sequencer.submit(() -> {
            throw new IllegalStateException("thrown");
        });
        Future<String> next = sequencer.submit(() -> Future.succeededFuture("ok"));

        assertInstanceOf(IllegalStateException.class, awaitFailure(throwing));
        assertEquals("ok", await(next));
    }
}
