package com.vestlock.adapter.out.registry;

import com.vestlock.domain.model.LockId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.vestlock.testsupport.Futures.await;
import static com.vestlock.testsupport.Futures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryPositionRegistryAdapter
 */
class InMemoryPositionRegistryAdapterTest {

    private static final LockId ID = LockId.of(1);

    private InMemoryPositionRegistryAdapter registry;

    @BeforeEach
    void setUp() throws Exception {
        registry = new InMemoryPositionRegistryAdapter();
        await(registry.register(ID, "alice"));
    }

    @Test
    void register_shouldRecordHolder() throws Exception {
        assertEquals("alice", await(registry.ownerOf(ID)));
        assertEquals(1L, await(registry.unitsHeld(ID, "alice")));
        assertEquals(0L, await(registry.unitsHeld(ID, "bob")));
    }

    @Test
    void register_twice_shouldFail() throws Exception {
        assertInstanceOf(IllegalStateException.class, awaitFailure(registry.register(ID, "bob")));
        assertEquals("alice", await(registry.ownerOf(ID)));
    }

    @Test
    void release_shouldForgetPosition() throws Exception {
        await(registry.release(ID));

        assertInstanceOf(IllegalStateException.class, awaitFailure(registry.ownerOf(ID)));
        assertInstanceOf(IllegalStateException.class, awaitFailure(registry.release(ID)));
        assertEquals(0L, await(registry.unitsHeld(ID, "alice")));
    }

    @Test
    void reassign_shouldOnlyMoveFromCurrentHolder() throws Exception {
        assertInstanceOf(IllegalStateException.class, awaitFailure(registry.reassign(ID, "bob", "carol")));

        await(registry.reassign(ID, "alice", "bob"));

        assertEquals("bob", await(registry.ownerOf(ID)));
    }
}
