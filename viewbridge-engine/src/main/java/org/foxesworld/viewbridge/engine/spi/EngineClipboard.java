package org.foxesworld.viewbridge.engine.spi;

public interface EngineClipboard {

    void clear();

    /** Current plain text, empty when the clipboard holds no text. */
    String readPlainText();

    void writePlainText(String text);
}
