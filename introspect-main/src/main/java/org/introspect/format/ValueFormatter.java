package org.introspect.format;

import org.introspect.runtime.Pointer;
import org.introspect.runtime.Values;
import org.introspect.types.CType;

/**
 * Printable text of a run-time value, chosen by the static type of the node it
 * belongs to:
 * <ul>
 *     <li>signed integers in decimal, unsigned ones in unsigned decimal;</li>
 *     <li>a non-null character pointer as its pointee text in double quotes;</li>
 *     <li>a null pointer of any type as {@value #NULL_LITERAL};</li>
 *     <li>any other pointer as a lowercase hexadecimal address.</li>
 * </ul>
 * Values no rule covers fall back to their raw integer text.
 */
public class ValueFormatter {

    public static final String NULL_LITERAL = "(nil)";

    public String format(Object value, CType type) {
        if (type.isPointer() || value instanceof Pointer) {
            return formatPointer(value, type);
        }
        if (type.isIntegral() && value instanceof Long) {
            long v = (Long) value;
            return type.isUnsigned() ? Long.toUnsignedString(v) : Long.toString(v);
        }
        return raw(value);
    }

    private String formatPointer(Object value, CType type) {
        if (!(value instanceof Pointer)) {
            return raw(value);
        }
        Pointer pointer = (Pointer) value;
        if (pointer.isNull()) {
            return NULL_LITERAL;
        }
        if (type.isCharPointer() && pointer.isReadable()) {
            return quote(pointer.readCString());
        }
        return "0x" + Long.toHexString(pointer.getAddress());
    }

    private static String raw(Object value) {
        if (value == null) {
            return "?";
        }
        if (value instanceof Number || value instanceof Pointer) {
            return Long.toString(Values.asLong(value));
        }
        return String.valueOf(value);
    }

    /**
     * C string-literal spelling of {@code bytes}: printable ASCII as is, the usual
     * escapes, and octal escapes for everything else.
     */
    static String quote(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length + 2);
        out.append('"');
        for (byte b : bytes) {
            int c = b & 0xff;
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> {
                    if (c >= 0x20 && c < 0x7f) {
                        out.append((char) c);
                    } else {
                        out.append(String.format("\\%03o", c));
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
