package org.foxesworld.viewbridge.engine.view;

import org.junit.jupiter.api.Test;

import static org.foxesworld.viewbridge.engine.view.LoadStateMachine.Action.*;
import static org.junit.jupiter.api.Assertions.*;

class LoadStateMachineTest {

    @Test
    void primingThenBindingThenReady() {
        LoadStateMachine m = new LoadStateMachine(2, 3, 10);
        m.startPriming();
        assertEquals(LoadState.PRIMING, m.state());

        assertEquals(NONE, m.onTick(false));
        assertEquals(ISSUE_LOAD, m.onTick(false));
        assertEquals(LoadState.BINDING, m.state());
        assertEquals(0, m.ticksInState());

        assertEquals(NONE, m.onTick(false));
        assertEquals(NONE, m.onTick(false));
        assertFalse(m.isReady());
        assertEquals(FINISH_BINDING, m.onTick(false));
        assertTrue(m.isReady());
        assertEquals(0, m.state().code());
    }

    @Test
    void readyWithBindingsDoesNothing() {
        LoadStateMachine m = new LoadStateMachine(2, 3, 10);
        assertTrue(m.isReady());
        for (int i = 0; i < 20; i++) assertEquals(NONE, m.onTick(true));
    }

    @Test
    void bindingRetriesAreBoundedAndReportedOnce() {
        LoadStateMachine m = new LoadStateMachine(1, 1, 3);
        assertEquals(RETRY_BINDINGS, m.onTick(false));
        assertEquals(RETRY_BINDINGS, m.onTick(false));
        assertEquals(RETRY_BINDINGS, m.onTick(false));
        assertEquals(REPORT_BINDING_FAILURE, m.onTick(false));
        assertEquals(NONE, m.onTick(false));
        assertEquals(NONE, m.onTick(false));

        m.markReady();
        assertEquals(RETRY_BINDINGS, m.onTick(false), "a new load re-arms the retries");
    }

    @Test
    void explicitLoadSupersedesPriming() {
        LoadStateMachine m = new LoadStateMachine(2, 3, 10);
        m.startPriming();
        m.onTick(false);
        m.markReady();
        assertTrue(m.isReady());
        assertEquals(NONE, m.onTick(true));
    }

    @Test
    void rejectsNonPositiveThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new LoadStateMachine(0, 3, 1));
        assertThrows(IllegalArgumentException.class, () -> new LoadStateMachine(2, 0, 1));
    }
}
