package org.foxesworld.viewbridge.engine.view;

/**
 * Deferred-load state of a view slot. The numeric code is what external callers see.
 */
public enum LoadState {
    /** Steady state, nothing pending. The only state in which a view reports ready. */
    READY(0),
    /** Surface freshly created, warming up before it accepts content. */
    PRIMING(1),
    /** Content issued, waiting for it to settle before script hooks are installed. */
    BINDING(2);

    private final int code;

    LoadState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
