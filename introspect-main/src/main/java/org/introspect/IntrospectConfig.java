package org.introspect;

import org.introspect.report.Terminator;

import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Settings read from system properties:
 * <ul>
 *     <li>{@value #COLOR_PROPERTY}: {@code auto} (default), {@code always} or
 *     {@code never}. {@code auto} colors output unless {@code NO_COLOR} is set or
 *     the JVM has no console.</li>
 *     <li>{@value #ABORT_PROPERTY}: {@code throw} (default) or {@code halt}.</li>
 * </ul>
 */
public final class IntrospectConfig {

    public static final String COLOR_PROPERTY = "introspect.color";
    public static final String ABORT_PROPERTY = "introspect.abort";

    public enum ColorMode {
        AUTO,
        ALWAYS,
        NEVER
    }

    public enum AbortMode {
        THROW,
        HALT
    }

    private final ColorMode colorMode;
    private final AbortMode abortMode;
    private final boolean colorsEnabled;

    private IntrospectConfig(ColorMode colorMode, AbortMode abortMode, boolean colorsEnabled) {
        this.colorMode = colorMode;
        this.abortMode = abortMode;
        this.colorsEnabled = colorsEnabled;
    }

    public static IntrospectConfig fromSystem() {
        return from(System.getProperties(), System.getenv(), System.console() != null);
    }

    public static IntrospectConfig from(Properties properties, Map<String, String> environment, boolean hasConsole) {
        ColorMode colorMode = parse(ColorMode.class, COLOR_PROPERTY, properties.getProperty(COLOR_PROPERTY, "auto"));
        AbortMode abortMode = parse(AbortMode.class, ABORT_PROPERTY, properties.getProperty(ABORT_PROPERTY, "throw"));
        boolean colors;
        switch (colorMode) {
            case ALWAYS:
                colors = true;
                break;
            case NEVER:
                colors = false;
                break;
            default:
                colors = hasConsole && !environment.containsKey("NO_COLOR");
                break;
        }
        return new IntrospectConfig(colorMode, abortMode, colors);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String property, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IntrospectException("Unknown value '" + value + "' for " + property, e);
        }
    }

    public ColorMode getColorMode() {
        return colorMode;
    }

    public AbortMode getAbortMode() {
        return abortMode;
    }

    public boolean colorsEnabled() {
        return colorsEnabled;
    }

    public Terminator terminator() {
        return abortMode == AbortMode.HALT ? Terminator.HALT : Terminator.THROW;
    }
}
