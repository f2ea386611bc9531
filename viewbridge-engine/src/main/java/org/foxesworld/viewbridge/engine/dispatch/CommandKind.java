package org.foxesworld.viewbridge.engine.dispatch;

public enum CommandKind {
    INIT,
    CREATE_VIEW,
    CREATE_VIEW_ASYNC,
    CREATE_VIEW_WITH_HTML,
    CREATE_VIEW_WITH_URL,
    DESTROY_VIEW,
    LOAD_HTML,
    LOAD_URL,
    TICK,
    LOCK_PIXELS,
    UNLOCK_PIXELS,
    COPY_PIXELS,
    QUIT
}
