package org.foxesworld.viewbridge.engine.view;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.engine.BridgeOptions;
import org.foxesworld.viewbridge.engine.spi.EngineSurface;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arena of {@link #MAX_VIEWS} slots. Ids are slot indexes; a new view always takes the
 * lowest free index. Allocation and release happen on the owner thread; lookups are safe
 * from any thread.
 */
public final class ViewRegistry {

    private static final Logger log = LogManager.getLogger(ViewRegistry.class);

    public static final int MAX_VIEWS = 16;

    private final ViewSlot[] slots = new ViewSlot[MAX_VIEWS];
    private int liveCount;

    public ViewRegistry(BridgeOptions options) {
        Objects.requireNonNull(options, "options");
        for (int i = 0; i < MAX_VIEWS; i++) {
            slots[i] = new ViewSlot(i, new LoadStateMachine(
                    options.primingTicks(), options.bindingTicks(), options.bindingRetryBudget()));
        }
    }

    public static boolean inRange(int id) {
        return id >= 0 && id < MAX_VIEWS;
    }

    /** @return lowest unused index, or -1 when every slot is live */
    public int lowestFree() {
        for (int i = 0; i < MAX_VIEWS; i++) {
            if (!slots[i].isLive()) return i;
        }
        return -1;
    }

    public ViewSlot occupy(int id, EngineSurface surface, int width, int height, int rowBytes) {
        ViewSlot s = slots[id];
        if (s.isLive()) throw new IllegalStateException("slot " + id + " is already live");
        s.occupy(Objects.requireNonNull(surface, "surface"), width, height, rowBytes);
        liveCount++;
        log.debug("[vb/views] occupied slot {} ({}x{}), live={}", id, width, height, liveCount);
        return s;
    }

    /** Clear a live slot. @return false if it was not live */
    public boolean release(int id) {
        if (!inRange(id) || !slots[id].isLive()) return false;
        slots[id].clear();
        liveCount--;
        log.debug("[vb/views] released slot {}, live={}", id, liveCount);
        return true;
    }

    /** @return the live slot for {@code id}, or null */
    public ViewSlot live(int id) {
        if (!inRange(id)) return null;
        ViewSlot s = slots[id];
        return s.isLive() ? s : null;
    }

    /** @return the slot at {@code id} in any state, or null when out of range */
    public ViewSlot slotAt(int id) {
        return inRange(id) ? slots[id] : null;
    }

    public boolean isLive(int id) {
        return live(id) != null;
    }

    public List<ViewSlot> liveSlots() {
        List<ViewSlot> out = new ArrayList<>(MAX_VIEWS);
        for (ViewSlot s : slots) if (s.isLive()) out.add(s);
        return out;
    }

    public int liveCount() {
        return liveCount;
    }

    /** Drop every slot to unused without touching engine surfaces. */
    public void resetAll() {
        for (ViewSlot s : slots) s.clear();
        liveCount = 0;
    }
}
