package org.foxesworld.viewbridge.engine.clipboard;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.viewbridge.engine.spi.EngineClipboard;

import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;

/**
 * Desktop clipboard through AWT. Access failures are logged and read as empty text.
 */
public final class SystemClipboard implements EngineClipboard {

    private static final Logger log = LogManager.getLogger(SystemClipboard.class);

    private final Clipboard clipboard;

    private SystemClipboard(Clipboard clipboard) {
        this.clipboard = clipboard;
    }

    /** System clipboard when a display is available, otherwise an in-memory one. */
    public static EngineClipboard createDefault() {
        if (GraphicsEnvironment.isHeadless()) {
            log.debug("[vb/clipboard] headless, using in-memory clipboard");
            return new InMemoryClipboard();
        }
        try {
            return new SystemClipboard(Toolkit.getDefaultToolkit().getSystemClipboard());
        } catch (HeadlessException | SecurityException e) {
            log.warn("[vb/clipboard] system clipboard unavailable ({}), using in-memory clipboard", e.toString());
            return new InMemoryClipboard();
        }
    }

    @Override
    public void clear() {
        writePlainText("");
    }

    @Override
    public String readPlainText() {
        try {
            if (!clipboard.isDataFlavorAvailable(DataFlavor.stringFlavor)) return "";
            Object data = clipboard.getData(DataFlavor.stringFlavor);
            return data instanceof String s ? s : "";
        } catch (UnsupportedFlavorException | IOException | IllegalStateException e) {
            log.warn("[vb/clipboard] read failed: {}", e.toString());
            return "";
        }
    }

    @Override
    public void writePlainText(String text) {
        try {
            clipboard.setContents(new StringSelection(text == null ? "" : text), null);
        } catch (IllegalStateException e) {
            log.warn("[vb/clipboard] write failed: {}", e.toString());
        }
    }
}
