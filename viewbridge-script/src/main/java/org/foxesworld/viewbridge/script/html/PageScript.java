package org.foxesworld.viewbridge.script.html;

/**
 * A {@code <script>} element: either external ({@code src}) or inline code.
 */
public record PageScript(String src, String code) {

    public boolean isExternal() {
        return src != null && !src.isEmpty();
    }
}
