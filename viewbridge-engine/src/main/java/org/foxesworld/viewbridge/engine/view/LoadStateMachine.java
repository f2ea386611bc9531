// FILE: LoadStateMachine.java
package org.foxesworld.viewbridge.engine.view;

/**
 * Per-slot deferred loading: PRIMING -> BINDING -> READY, advanced once per tick.
 *
 * <p>Engine-free: {@link #onTick()} only says which action is due; the caller performs it.
 * Also tracks opportunistic binding retries for READY slots and their budget.</p>
 *
 * <p>State is written on the owner thread and read by callers polling readiness.</p>
 */
public final class LoadStateMachine {

    /** Work the caller must do for the tick that was just counted. */
    public enum Action {
        NONE,
        /** Issue the stored payload to the surface; the machine is now BINDING. */
        ISSUE_LOAD,
        /** Render and try to install bindings; the machine is now READY. */
        FINISH_BINDING,
        /** READY without bindings and still within budget: try to install them again. */
        RETRY_BINDINGS,
        /** READY without bindings and the retry budget just ran out: report it once. */
        REPORT_BINDING_FAILURE
    }

    private final int primingTicks;
    private final int bindingTicks;
    private final int retryBudget;

    private volatile LoadState state = LoadState.READY;
    private int ticks;
    private int retries;
    private boolean failureReported;

    public LoadStateMachine(int primingTicks, int bindingTicks, int retryBudget) {
        if (primingTicks < 1 || bindingTicks < 1) throw new IllegalArgumentException("thresholds must be >= 1");
        this.primingTicks = primingTicks;
        this.bindingTicks = bindingTicks;
        this.retryBudget = Math.max(0, retryBudget);
    }

    public LoadState state() {
        return state;
    }

    public boolean isReady() {
        return state == LoadState.READY;
    }

    public int ticksInState() {
        return ticks;
    }

    /** Asynchronously created surface: wait before issuing content. */
    public void startPriming() {
        enter(LoadState.PRIMING);
        rearmRetries();
    }

    /** Synchronous path (or an explicit load superseding a deferred one). */
    public void markReady() {
        enter(LoadState.READY);
        rearmRetries();
    }

    public void reset() {
        markReady();
    }

    /**
     * Count one tick and return the action due.
     *
     * @param bindingsInstalled whether the slot currently has its script bindings
     */
    public Action onTick(boolean bindingsInstalled) {
        switch (state) {
            case PRIMING -> {
                if (++ticks >= primingTicks) {
                    enter(LoadState.BINDING);
                    return Action.ISSUE_LOAD;
                }
                return Action.NONE;
            }
            case BINDING -> {
                if (++ticks >= bindingTicks) {
                    enter(LoadState.READY);
                    return Action.FINISH_BINDING;
                }
                return Action.NONE;
            }
            default -> {
                if (bindingsInstalled || failureReported) return Action.NONE;
                if (retries < retryBudget) {
                    retries++;
                    return Action.RETRY_BINDINGS;
                }
                failureReported = true;
                return Action.REPORT_BINDING_FAILURE;
            }
        }
    }

    private void enter(LoadState next) {
        state = next;
        ticks = 0;
    }

    private void rearmRetries() {
        retries = 0;
        failureReported = false;
    }
}
