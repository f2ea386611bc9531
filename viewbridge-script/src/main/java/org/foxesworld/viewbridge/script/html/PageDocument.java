// FILE: PageDocument.java
package org.foxesworld.viewbridge.script.html;

import org.foxesworld.viewbridge.script.paint.CssColor;
import org.graalvm.polyglot.proxy.ProxyObject;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed page as the headless surface sees it: title, background, scripts in document
 * order, and element lookup by id.
 */
public final class PageDocument {

    public static final String BLANK_NAME = "about:blank";

    private final Document doc;
    private final String name;

    PageDocument(Document doc, String name) {
        this.doc = doc;
        this.name = name == null ? "" : name;
    }

    public static PageDocument blank() {
        return new PageDocument(Jsoup.parse(""), BLANK_NAME);
    }

    public static PageDocument fromHtml(String html, String name) {
        return new PageDocument(Jsoup.parse(html == null ? "" : html), name);
    }

    public String name() {
        return name;
    }

    public boolean isBlank() {
        return BLANK_NAME.equals(name);
    }

    public String title() {
        return doc.title();
    }

    /**
     * Body background from {@code bgcolor} or an inline {@code background(-color)} style,
     * as written in the markup; empty when none.
     */
    public String background() {
        Element body = doc.body();
        String fromStyle = styleValue(body.attr("style"));
        if (!fromStyle.isEmpty()) return fromStyle;
        if (body.hasAttr("bgcolor")) return body.attr("bgcolor").trim();
        Element html = doc.selectFirst("html");
        return html == null ? "" : styleValue(html.attr("style"));
    }

    /** Background as ARGB: opaque white for pages without one, transparent for the blank page. */
    public int backgroundArgb(String override) {
        Integer c = CssColor.parse(override);
        if (c != null) return c;
        c = CssColor.parse(background());
        if (c != null) return c;
        return isBlank() ? CssColor.TRANSPARENT : CssColor.WHITE;
    }

    /** Classic scripts in document order; module and data blocks are skipped. */
    public List<PageScript> scripts() {
        List<PageScript> out = new ArrayList<>();
        for (Element el : doc.select("script")) {
            String type = el.attr("type").trim().toLowerCase(Locale.ROOT);
            if (!type.isEmpty() && !type.contains("javascript") && !type.equals("text/ecmascript")) continue;
            if (el.hasAttr("src")) out.add(new PageScript(el.attr("src").trim(), null));
            else out.add(new PageScript(null, el.data()));
        }
        return out;
    }

    /**
     * Read-only snapshot of the element with {@code id} for scripts.
     *
     * @return null if there is no such element
     */
    public ProxyObject elementProxy(String id) {
        if (id == null || id.isEmpty()) return null;
        Element el = doc.getElementById(id);
        if (el == null) return null;

        Map<String, Object> attrs = new HashMap<>();
        el.attributes().forEach(a -> attrs.put(a.getKey().toLowerCase(Locale.ROOT), a.getValue()));

        Map<String, Object> m = new HashMap<>();
        m.put("id", el.id());
        m.put("tagName", el.tagName().toUpperCase(Locale.ROOT));
        m.put("textContent", el.text());
        m.put("className", el.className());
        m.put("attributes", ProxyObject.fromMap(attrs));
        return ProxyObject.fromMap(m);
    }

    private static String styleValue(String style) {
        if (style == null || style.isBlank()) return "";
        String found = "";
        for (String part : style.split(";")) {
            int c = part.indexOf(':');
            if (c < 0) continue;
            String k = part.substring(0, c).trim().toLowerCase(Locale.ROOT);
            if (k.equals("background") || k.equals("background-color")) found = part.substring(c + 1).trim();
        }
        return found;
    }
}
