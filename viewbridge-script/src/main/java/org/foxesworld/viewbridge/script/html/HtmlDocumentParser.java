package org.foxesworld.viewbridge.script.html;

import org.foxesworld.viewbridge.core.io.ByteParser;
import org.jsoup.Jsoup;

import java.nio.charset.StandardCharsets;

/**
 * Resource bytes (always UTF-8) to a {@link PageDocument}, backed by jsoup.
 */
public final class HtmlDocumentParser extends ByteParser<PageDocument> {

    @Override
    protected PageDocument parseBytes(byte[] data, String name) {
        return new PageDocument(Jsoup.parse(new String(data, StandardCharsets.UTF_8)), name);
    }
}
