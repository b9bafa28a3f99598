package org.introspect.types;

import org.introspect.TypeResolutionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Type-name parsing and the usual arithmetic conversions.
 */
public final class CTypes {

    private CTypes() {}

    private static final Map<String, CType> STANDARD_TYPEDEFS = Map.ofEntries(
            Map.entry("size_t", CType.UNSIGNED_LONG),
            Map.entry("ssize_t", CType.LONG),
            Map.entry("ptrdiff_t", CType.LONG),
            Map.entry("intptr_t", CType.LONG),
            Map.entry("uintptr_t", CType.UNSIGNED_LONG),
            Map.entry("int8_t", CType.SIGNED_CHAR),
            Map.entry("uint8_t", CType.UNSIGNED_CHAR),
            Map.entry("int16_t", CType.SHORT),
            Map.entry("uint16_t", CType.UNSIGNED_SHORT),
            Map.entry("int32_t", CType.INT),
            Map.entry("uint32_t", CType.UNSIGNED_INT),
            Map.entry("int64_t", CType.LONG),
            Map.entry("uint64_t", CType.UNSIGNED_LONG),
            Map.entry("bool", CType.BOOL)
    );

    public static CType parse(String spelling) {
        return parse(spelling, Map.of());
    }

    /**
     * Parses a C type name such as {@code unsigned short}, {@code const char *} or
     * {@code uint32_t}. Specifier order is free, as in C.
     *
     * @throws TypeResolutionException if the spelling names no known type
     */
    public static CType parse(String spelling, Map<String, CType> typedefs) {
        String text = spelling.trim();
        int pointerDepth = 0;
        while (text.endsWith("*")) {
            pointerDepth++;
            text = text.substring(0, text.length() - 1).trim();
        }
        if (text.isEmpty()) {
            throw new TypeResolutionException(spelling);
        }

        boolean isConst = false;
        List<String> specifiers = new ArrayList<>();
        for (String token : text.split("\\s+")) {
            if (token.equals("const")) {
                isConst = true;
            } else if (!token.equals("volatile")) {
                specifiers.add(token);
            }
        }

        CType base = resolveSpecifiers(spelling, specifiers, typedefs);
        if (isConst) {
            base = base.withConst();
        }
        for (int i = 0; i < pointerDepth; i++) {
            base = CType.pointerTo(base);
        }
        return base;
    }

    private static CType resolveSpecifiers(String spelling, List<String> specifiers, Map<String, CType> typedefs) {
        if (specifiers.size() == 1) {
            String single = specifiers.get(0);
            CType typedef = typedefs.get(single);
            if (typedef == null) {
                typedef = STANDARD_TYPEDEFS.get(single);
            }
            if (typedef != null) {
                return typedef;
            }
        }

        int longs = 0;
        boolean isUnsigned = false;
        boolean isSigned = false;
        boolean isShort = false;
        String base = null;
        for (String token : specifiers) {
            switch (token) {
                case "long" -> longs++;
                case "unsigned" -> isUnsigned = true;
                case "signed" -> isSigned = true;
                case "short" -> isShort = true;
                case "int", "char", "void", "_Bool" -> {
                    if (base != null) {
                        throw new TypeResolutionException(spelling);
                    }
                    base = token;
                }
                default -> throw new TypeResolutionException(spelling);
            }
        }
        if (isSigned && isUnsigned) {
            throw new TypeResolutionException(spelling);
        }

        if ("void".equals(base) || "_Bool".equals(base)) {
            if (longs > 0 || isShort || isSigned || isUnsigned) {
                throw new TypeResolutionException(spelling);
            }
            return base.equals("void") ? CType.VOID : CType.BOOL;
        }
        if ("char".equals(base)) {
            if (longs > 0 || isShort) {
                throw new TypeResolutionException(spelling);
            }
            return isUnsigned ? CType.UNSIGNED_CHAR : isSigned ? CType.SIGNED_CHAR : CType.CHAR;
        }
        if (base == null && longs == 0 && !isShort && !isSigned && !isUnsigned) {
            throw new TypeResolutionException(spelling);
        }
        if (isShort) {
            if (longs > 0) {
                throw new TypeResolutionException(spelling);
            }
            return isUnsigned ? CType.UNSIGNED_SHORT : CType.SHORT;
        }
        return switch (longs) {
            case 0 -> isUnsigned ? CType.UNSIGNED_INT : CType.INT;
            case 1 -> isUnsigned ? CType.UNSIGNED_LONG : CType.LONG;
            case 2 -> isUnsigned ? CType.UNSIGNED_LONG_LONG : CType.LONG_LONG;
            default -> throw new TypeResolutionException(spelling);
        };
    }

    /**
     * Integer promotion: every integral type narrower than {@code int} becomes {@code int}.
     */
    public static CType promote(CType type) {
        CType t = type.unqualified();
        if (t.isIntegral() && t.getRank() < CType.INT.getRank()) {
            return CType.INT;
        }
        return t;
    }

    /**
     * The common type of two integral operands after the usual arithmetic conversions.
     */
    public static CType commonType(CType left, CType right) {
        CType l = promote(left);
        CType r = promote(right);
        if (l.equals(r)) {
            return l;
        }
        if (l.isUnsigned() == r.isUnsigned()) {
            return l.getRank() >= r.getRank() ? l : r;
        }
        CType unsignedType = l.isUnsigned() ? l : r;
        CType signedType = l.isUnsigned() ? r : l;
        if (unsignedType.getRank() >= signedType.getRank()) {
            return unsignedType;
        }
        if (signedType.getBits() > unsignedType.getBits()) {
            return signedType;
        }
        return unsignedVariant(signedType);
    }

    static CType unsignedVariant(CType type) {
        if (type.equals(CType.LONG_LONG)) {
            return CType.UNSIGNED_LONG_LONG;
        }
        if (type.equals(CType.LONG)) {
            return CType.UNSIGNED_LONG;
        }
        if (type.equals(CType.INT)) {
            return CType.UNSIGNED_INT;
        }
        if (type.equals(CType.SHORT)) {
            return CType.UNSIGNED_SHORT;
        }
        if (type.isCharacter()) {
            return CType.UNSIGNED_CHAR;
        }
        return type;
    }
}
