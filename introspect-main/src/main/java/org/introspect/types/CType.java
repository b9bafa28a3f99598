package org.introspect.types;

import java.util.Objects;

/**
 * Static type of an expression node, modelled after the C scalar types an assertion
 * condition can carry: {@code _Bool}, the integer family and pointers.
 * <p>
 * Names use the canonical spelling of the C front end ({@code short int},
 * {@code long unsigned int}, {@code char *}) because they appear verbatim in
 * rendered casts.
 */
public final class CType {

    public enum Kind {
        VOID,
        BOOL,
        INTEGER,
        POINTER
    }

    public static final CType VOID = new CType(Kind.VOID, "void", 8, true, 0, null, false);
    public static final CType BOOL = new CType(Kind.BOOL, "_Bool", 8, true, 0, null, false);
    public static final CType CHAR = new CType(Kind.INTEGER, "char", 8, false, 1, null, false);
    public static final CType SIGNED_CHAR = new CType(Kind.INTEGER, "signed char", 8, false, 1, null, false);
    public static final CType UNSIGNED_CHAR = new CType(Kind.INTEGER, "unsigned char", 8, true, 1, null, false);
    public static final CType SHORT = new CType(Kind.INTEGER, "short int", 16, false, 2, null, false);
    public static final CType UNSIGNED_SHORT = new CType(Kind.INTEGER, "short unsigned int", 16, true, 2, null, false);
    public static final CType INT = new CType(Kind.INTEGER, "int", 32, false, 3, null, false);
    public static final CType UNSIGNED_INT = new CType(Kind.INTEGER, "unsigned int", 32, true, 3, null, false);
    public static final CType LONG = new CType(Kind.INTEGER, "long int", 64, false, 4, null, false);
    public static final CType UNSIGNED_LONG = new CType(Kind.INTEGER, "long unsigned int", 64, true, 4, null, false);
    public static final CType LONG_LONG = new CType(Kind.INTEGER, "long long int", 64, false, 5, null, false);
    public static final CType UNSIGNED_LONG_LONG = new CType(Kind.INTEGER, "long long unsigned int", 64, true, 5, null, false);

    public static final CType CHAR_POINTER = pointerTo(CHAR);
    public static final CType VOID_POINTER = pointerTo(VOID);

    private static final int POINTER_BITS = 64;

    private final Kind kind;
    private final String name;
    private final int bits;
    private final boolean unsigned;
    private final int rank;
    private final CType pointee;
    private final boolean constQualified;

    private CType(Kind kind, String name, int bits, boolean unsigned, int rank, CType pointee, boolean constQualified) {
        this.kind = kind;
        this.name = name;
        this.bits = bits;
        this.unsigned = unsigned;
        this.rank = rank;
        this.pointee = pointee;
        this.constQualified = constQualified;
    }

    public static CType pointerTo(CType pointee) {
        String name = pointee.isPointer() ? pointee.name + "*" : pointee.name + " *";
        return new CType(Kind.POINTER, name, POINTER_BITS, true, 0, pointee, false);
    }

    /**
     * A {@code const}-qualified copy. Qualification only affects the spelling.
     */
    public CType withConst() {
        if (constQualified) {
            return this;
        }
        if (isPointer()) {
            return new CType(kind, name + " const", bits, unsigned, rank, pointee, true);
        }
        return new CType(kind, "const " + name, bits, unsigned, rank, pointee, true);
    }

    public CType unqualified() {
        if (!constQualified) {
            return this;
        }
        if (isPointer()) {
            return pointerTo(pointee);
        }
        return new CType(kind, name.substring("const ".length()), bits, unsigned, rank, pointee, false);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public int getBits() {
        return bits;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public int getRank() {
        return rank;
    }

    public CType getPointee() {
        return pointee;
    }

    public boolean isConstQualified() {
        return constQualified;
    }

    public boolean isPointer() {
        return kind == Kind.POINTER;
    }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    /**
     * Integers and {@code _Bool}.
     */
    public boolean isIntegral() {
        return kind == Kind.INTEGER || kind == Kind.BOOL;
    }

    public boolean isScalar() {
        return isIntegral() || isPointer();
    }

    public boolean isCharacter() {
        return kind == Kind.INTEGER && bits == 8;
    }

    public boolean isCharPointer() {
        return isPointer() && pointee.isCharacter();
    }

    /**
     * Size in bytes. {@code void} counts as one byte for pointer arithmetic, as GNU C does.
     */
    public int sizeOf() {
        return Math.max(1, bits / 8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CType)) {
            return false;
        }
        CType other = (CType) o;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
