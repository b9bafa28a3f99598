package org.introspect.render;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A small cyclic set of ANSI foreground colors.
 */
public final class Palette {

    public static final String RESET = "\u001b[0m";

    public static final Palette DEFAULT = new Palette(List.of(31, 32, 33, 34, 35, 36));

    private static final Pattern ESCAPE = Pattern.compile("\u001b\\[[0-9;]*m");

    private final List<Integer> sgrCodes;

    public Palette(List<Integer> sgrCodes) {
        if (sgrCodes.isEmpty()) {
            throw new IllegalArgumentException("A palette needs at least one color");
        }
        this.sgrCodes = List.copyOf(sgrCodes);
    }

    public int size() {
        return sgrCodes.size();
    }

    public String start(int colorId) {
        return "\u001b[" + sgrCodes.get(colorId % sgrCodes.size()) + "m";
    }

    /**
     * Wraps {@code text} in a color. Resets already inside {@code text} are
     * followed by this color again, so nested spans keep the outer color after
     * they end.
     */
    public String paint(String text, int colorId) {
        String start = start(colorId);
        return start + text.replace(RESET, RESET + start) + RESET;
    }

    /**
     * Removes every color escape; line content is otherwise unchanged.
     */
    public static String strip(String text) {
        return ESCAPE.matcher(text).replaceAll("");
    }
}
