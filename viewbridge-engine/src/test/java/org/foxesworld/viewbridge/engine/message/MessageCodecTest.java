package org.foxesworld.viewbridge.engine.message;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    @Test
    void receiveScriptGuardsOnTheCallback() {
        String js = MessageCodec.receiveScript(List.of(1, 2));
        assertEquals("if(window.host&&typeof window.host.receive==='function')"
                + "window.host.receive(JSON.parse(\"[1,2]\"));", js);
    }

    @Test
    void receiveScriptEscapesForAStringLiteral() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("text", "say \"hi\"\nback\\slash <b>");
        m.put("none", null);
        String js = MessageCodec.receiveScript(m);

        assertTrue(js.contains("JSON.parse(\"{\\\"text\\\":\\\"say \\\\\\\"hi\\\\\\\"\\\\nback\\\\\\\\slash <b>\\\",\\\"none\\\":null}\")"), js);
        assertFalse(js.contains("\n"));
    }

    @Test
    void lineSeparatorsAreEscaped() {
        String js = MessageCodec.receiveScript("a\u2028b\u2029c");
        assertEquals(-1, js.indexOf('\u2028'));
        assertEquals(-1, js.indexOf('\u2029'));
        assertTrue(js.contains("\\u2028") && js.contains("\\u2029"), js);
    }

    @Test
    void parseRecognisesJsonMessages() {
        Object obj = MessageCodec.parse("  {\"type\":\"click\",\"x\":3} ");
        JsonObject o = assertInstanceOf(JsonElement.class, obj).getAsJsonObject();
        assertEquals("click", o.get("type").getAsString());
        assertEquals(3, o.get("x").getAsInt());

        assertTrue(((JsonElement) MessageCodec.parse("[1,2]")).isJsonArray());
    }

    @Test
    void parseKeepsPlainText() {
        assertEquals("hello", MessageCodec.parse(" hello "));
        assertEquals("{not closed", MessageCodec.parse("{not closed"));
        assertNull(MessageCodec.parse("   "));
        assertNull(MessageCodec.parse(null));
    }

    @Test
    void parseRejectsMalformedJson() {
        assertThrows(JsonParseException.class, () -> MessageCodec.parse("{\"a\":}"));
    }

    @Test
    void fromJsonBindsTypes() {
        Point p = MessageCodec.fromJson("{\"x\":4,\"y\":5}", Point.class);
        assertEquals(4, p.x);
        assertEquals(5, p.y);
        assertEquals("{\"x\":4,\"y\":5}", MessageCodec.toJson(p));
    }

    static final class Point {
        int x;
        int y;
    }
}
