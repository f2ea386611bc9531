package org.foxesworld.viewbridge.engine.view;

import org.foxesworld.viewbridge.engine.BridgeOptions;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViewRegistryTest {

    // never invoked: the registry only stores the surface
    private static final EngineSurface SURFACE = (EngineSurface) Proxy.newProxyInstance(
            EngineSurface.class.getClassLoader(), new Class<?>[]{EngineSurface.class},
            (proxy, method, args) -> {
                throw new UnsupportedOperationException(method.getName());
            });

    private final ViewRegistry registry = new ViewRegistry(BridgeOptions.defaults());

    @Test
    void inputFromAReleasedViewNeverReachesItsSuccessor() {
        ViewSlot slot = registry.occupy(0, SURFACE, 8, 8, 32);
        int stale = slot.generation();

        registry.release(0);
        assertSame(slot, registry.occupy(registry.lowestFree(), SURFACE, 8, 8, 32));
        assertTrue(slot.isLive());
        assertNotEquals(stale, slot.generation());

        assertFalse(slot.enqueuePointer(stale, PointerEvent.MOVED, 1, 1, PointerEvent.BUTTON_LEFT));
        assertFalse(slot.enqueueWheel(stale, 0, 0, 3));
        assertFalse(slot.enqueueKey(stale, 1, 65, 0, "a"));
        assertFalse(slot.enqueueScript(stale, "1+1"));
        assertTrue(slot.pointerQueue().isEmpty());
        assertTrue(slot.wheelQueue().isEmpty());
        assertTrue(slot.keyQueue().isEmpty());
        assertTrue(slot.scriptQueue().isEmpty());

        assertTrue(slot.enqueuePointer(slot.generation(), PointerEvent.MOVED, 1, 1, PointerEvent.BUTTON_LEFT));
        assertEquals(1, slot.pointerQueue().size());
    }

    @Test
    void releasedSlotRefusesInput() {
        ViewSlot slot = registry.occupy(3, SURFACE, 8, 8, 32);
        int gen = slot.generation();
        registry.release(3);
        assertFalse(slot.enqueueScript(gen, "x"));
        assertFalse(slot.enqueueScript(slot.generation(), "x"));
        assertNull(registry.live(3));
        assertSame(slot, registry.slotAt(3));
        assertNull(registry.slotAt(16));
    }

    @Test
    void concurrentReleaseLeavesNoStaleEntries() throws InterruptedException {
        ViewSlot slot = registry.occupy(0, SURFACE, 8, 8, 32);
        int stale = slot.generation();
        List<Thread> producers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            Thread th = new Thread(() -> {
                for (int i = 0; i < 500; i++) slot.enqueueScript(stale, "s" + i);
            });
            producers.add(th);
            th.start();
        }
        registry.release(0);
        registry.occupy(0, SURFACE, 8, 8, 32);
        for (Thread th : producers) th.join();

        assertTrue(slot.scriptQueue().isEmpty(), "entries offered under the old generation were dropped or cleared");
    }
}
