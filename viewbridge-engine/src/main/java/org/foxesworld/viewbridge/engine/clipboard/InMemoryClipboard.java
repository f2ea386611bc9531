package org.foxesworld.viewbridge.engine.clipboard;

import org.foxesworld.viewbridge.engine.spi.EngineClipboard;

/** Process-local clipboard; used headless and in tests. */
public final class InMemoryClipboard implements EngineClipboard {

    private volatile String text = "";

    @Override
    public void clear() {
        text = "";
    }

    @Override
    public String readPlainText() {
        return text;
    }

    @Override
    public void writePlainText(String text) {
        this.text = text == null ? "" : text;
    }
}
