package org.introspect.types;

import org.introspect.TypeResolutionException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CTypesTest {

    // ── parsing ──

    @Test
    void parse_specifiersInAnyOrder() {
        assertThat(CTypes.parse("unsigned short")).isEqualTo(CType.UNSIGNED_SHORT);
        assertThat(CTypes.parse("short unsigned int")).isEqualTo(CType.UNSIGNED_SHORT);
        assertThat(CTypes.parse("long long unsigned")).isEqualTo(CType.UNSIGNED_LONG_LONG);
        assertThat(CTypes.parse("signed")).isEqualTo(CType.INT);
        assertThat(CTypes.parse("signed char")).isEqualTo(CType.SIGNED_CHAR);
    }

    @Test
    void parse_pointersAndConst() {
        CType constCharPointer = CTypes.parse("const char *");

        assertThat(constCharPointer.isPointer()).isTrue();
        assertThat(constCharPointer.isCharPointer()).isTrue();
        assertThat(constCharPointer.getName()).isEqualTo("const char *");
        assertThat(CTypes.parse("int **").getName()).isEqualTo("int **");
        assertThat(CTypes.parse("void*")).isEqualTo(CType.VOID_POINTER);
    }

    @Test
    void parse_standardAndCustomTypedefs() {
        assertThat(CTypes.parse("size_t")).isEqualTo(CType.UNSIGNED_LONG);
        assertThat(CTypes.parse("int16_t")).isEqualTo(CType.SHORT);
        assertThat(CTypes.parse("handle", Map.of("handle", CType.UNSIGNED_INT))).isEqualTo(CType.UNSIGNED_INT);
    }

    @Test
    void parse_rejectsContradictions() {
        assertThatThrownBy(() -> CTypes.parse("signed unsigned int")).isInstanceOf(TypeResolutionException.class);
        assertThatThrownBy(() -> CTypes.parse("long char")).isInstanceOf(TypeResolutionException.class);
        assertThatThrownBy(() -> CTypes.parse("widget")).isInstanceOf(TypeResolutionException.class);
        assertThatThrownBy(() -> CTypes.parse("*")).isInstanceOf(TypeResolutionException.class);
    }

    // ── conversions ──

    @Test
    void promote_narrowTypesBecomeInt() {
        assertThat(CTypes.promote(CType.CHAR)).isEqualTo(CType.INT);
        assertThat(CTypes.promote(CType.UNSIGNED_SHORT)).isEqualTo(CType.INT);
        assertThat(CTypes.promote(CType.BOOL)).isEqualTo(CType.INT);
        assertThat(CTypes.promote(CType.UNSIGNED_INT)).isEqualTo(CType.UNSIGNED_INT);
    }

    @Test
    void commonType_usualArithmeticConversions() {
        assertThat(CTypes.commonType(CType.SHORT, CType.CHAR)).isEqualTo(CType.INT);
        assertThat(CTypes.commonType(CType.INT, CType.UNSIGNED_INT)).isEqualTo(CType.UNSIGNED_INT);
        assertThat(CTypes.commonType(CType.LONG, CType.UNSIGNED_INT)).isEqualTo(CType.LONG);
        assertThat(CTypes.commonType(CType.LONG_LONG, CType.UNSIGNED_LONG)).isEqualTo(CType.UNSIGNED_LONG_LONG);
        assertThat(CTypes.commonType(CType.LONG, CType.INT)).isEqualTo(CType.LONG);
    }

    @Test
    void declarations_resolveThroughTypedefs() {
        Declarations declarations = Declarations.builder()
                .typedef("counter_t", "unsigned long")
                .variable("count", "counter_t")
                .function("next", "counter_t", "int")
                .build();

        assertThat(declarations.variable("count")).contains(CType.UNSIGNED_LONG);
        assertThat(declarations.function("next")).hasValueSatisfying(f -> {
            assertThat(f.returnType()).isEqualTo(CType.UNSIGNED_LONG);
            assertThat(f.accepts(1)).isTrue();
            assertThat(f.accepts(2)).isFalse();
        });
        assertThat(declarations.variable("other")).isEmpty();
    }
}
