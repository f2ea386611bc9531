package org.foxesworld.viewbridge.engine.spi;

/**
 * File-system integration point. The engine calls it from the owner thread while it
 * resolves content (documents, scripts, styles, images).
 */
public interface EngineFileSystem {

    boolean fileExists(String path);

    String mimeType(String path);

    String charset(String path);

    /**
     * @return the resource, or null when nothing is found. The engine must close it when done.
     */
    EngineResource open(String path);
}
