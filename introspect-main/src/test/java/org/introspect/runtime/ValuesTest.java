package org.introspect.runtime;

import org.introspect.ExpressionEvaluationException;
import org.introspect.types.CType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValuesTest {

    @Test
    void normalize_truncatesAndExtends() {
        assertThat(Values.normalize(70000L, CType.SHORT)).isEqualTo(4464L);
        assertThat(Values.normalize(0xFFFFL, CType.SHORT)).isEqualTo(-1L);
        assertThat(Values.normalize(-1L, CType.UNSIGNED_CHAR)).isEqualTo(255L);
        assertThat(Values.normalize(42L, CType.BOOL)).isEqualTo(1L);
        assertThat(Values.normalize(Long.MIN_VALUE, CType.LONG)).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void coerce_acceptsHostRepresentations() {
        assertThat(Values.coerce(true, CType.INT)).isEqualTo(1L);
        assertThat(Values.coerce('A', CType.CHAR)).isEqualTo(65L);
        assertThat(Values.coerce(7, CType.LONG)).isEqualTo(7L);
        assertThat(Values.coerce(null, CType.CHAR_POINTER)).isEqualTo(Pointer.NULL);
        assertThat(Values.coerce(0x10L, CType.VOID_POINTER)).isEqualTo(Pointer.ofAddress(0x10L));
    }

    @Test
    void coerce_rejectsMismatchedValues() {
        assertThatThrownBy(() -> Values.coerce("text", CType.INT))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("String");
        assertThatThrownBy(() -> Values.coerce("text", CType.CHAR_POINTER))
                .isInstanceOf(ExpressionEvaluationException.class);
    }

    @Test
    void compare_pointersAsUnsignedAddresses() {
        Pointer high = Pointer.ofAddress(0x8000_0000_0000_0000L);
        Pointer low = Pointer.ofAddress(0x10L);

        assertThat(Values.compare(high, low, false)).isPositive();
        assertThat(Values.compare(-1L, 1L, false)).isNegative();
        assertThat(Values.compare(-1L, 1L, true)).isPositive();
    }

    @Test
    void simulatedEnvironment_internsLiteralsAndKeepsAddressesStable() {
        SimulatedEnvironment environment = new SimulatedEnvironment().set("n", 1).set("m", 2);

        assertThat(environment.stringLiteral("abc")).isSameAs(environment.stringLiteral("abc"));
        assertThat(environment.addressOf("n")).isEqualTo(environment.addressOf("n"));
        assertThat(environment.addressOf("n")).isNotEqualTo(environment.addressOf("m"));
        assertThat(environment.allocateString("x").getAddress() % 16).isZero();
    }

    @Test
    void pointer_withoutStorageIsNotReadable() {
        assertThat(Pointer.ofAddress(0L)).isSameAs(Pointer.NULL);
        assertThatThrownBy(() -> Pointer.ofAddress(0x20L).readCString())
                .isInstanceOf(ExpressionEvaluationException.class);
    }
}
