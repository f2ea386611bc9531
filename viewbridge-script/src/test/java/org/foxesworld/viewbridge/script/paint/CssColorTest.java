package org.foxesworld.viewbridge.script.paint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CssColorTest {

    @Test
    void hexForms() {
        assertEquals(0xFFFF0000, CssColor.parse("#ff0000"));
        assertEquals(0xFF112233, CssColor.parse("#123"));
        assertEquals(0x80FF0000, CssColor.parse("#FF000080"));
        assertNull(CssColor.parse("#12"));
        assertNull(CssColor.parse("#zzzzzz"));
    }

    @Test
    void functionalForms() {
        assertEquals(0xFF0A141E, CssColor.parse("rgb(10, 20, 30)"));
        assertEquals(0x800000FF, CssColor.parse("rgba(0,0,255,0.5)"));
        assertEquals(0xFFFF0000, CssColor.parse("rgb(300, -4, 0)"));
        assertNull(CssColor.parse("rgb(1,2)"));
        assertNull(CssColor.parse("rgb(a,b,c)"));
    }

    @Test
    void namesAndShorthand() {
        assertEquals(CssColor.WHITE, CssColor.parse(" White "));
        assertEquals(CssColor.TRANSPARENT, CssColor.parse("transparent"));
        assertEquals(0xFF000000, CssColor.parse("#000 url(bg.png) no-repeat"));
        assertNull(CssColor.parse("chartreuse"));
        assertNull(CssColor.parse(""));
        assertNull(CssColor.parse(null));
    }
}
