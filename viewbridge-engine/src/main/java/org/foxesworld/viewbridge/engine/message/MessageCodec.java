package org.foxesworld.viewbridge.engine.message;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * JSON between host and page.
 *
 * <p>Host to page: {@link #receiveScript(Object)} builds a script that hands the parsed value
 * to {@code window.host.receive} when the page defined it. Page to host: {@link #parse(String)}
 * turns JSON-looking messages into a {@link JsonElement}.</p>
 */
public final class MessageCodec {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private MessageCodec() {}

    public static String toJson(Object data) {
        return GSON.toJson(data);
    }

    /** Script delivering {@code data} to the page's receive callback. */
    public static String receiveScript(Object data) {
        String json = toJson(data);
        StringBuilder sb = new StringBuilder(json.length() + 96);
        sb.append("if(window.host&&typeof window.host.receive==='function')window.host.receive(JSON.parse(\"");
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\u2028' -> sb.append("\\u2028");
                case '\u2029' -> sb.append("\\u2029");
                default -> sb.append(c);
            }
        }
        sb.append("\"));");
        return sb.toString();
    }

    /**
     * Parse a page message.
     *
     * @return null for blank input, a {@link JsonElement} when the trimmed text starts with
     *         '{' or '[' and ends with the matching bracket, otherwise the trimmed string
     * @throws JsonParseException when the message looks like JSON but is malformed
     */
    public static Object parse(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.isEmpty()) return null;
        if ((m.startsWith("{") && m.endsWith("}")) || (m.startsWith("[") && m.endsWith("]"))) {
            return JsonParser.parseString(m);
        }
        return m;
    }

    public static <T> T fromJson(String json, Class<T> type) {
        return GSON.fromJson(json, type);
    }
}
