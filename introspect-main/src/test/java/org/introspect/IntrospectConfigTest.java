package org.introspect;

import org.introspect.report.Terminator;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntrospectConfigTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    void defaults_autoColorAndThrow() {
        IntrospectConfig config = IntrospectConfig.from(properties(), Map.of(), true);

        assertThat(config.getColorMode()).isEqualTo(IntrospectConfig.ColorMode.AUTO);
        assertThat(config.colorsEnabled()).isTrue();
        assertThat(config.getAbortMode()).isEqualTo(IntrospectConfig.AbortMode.THROW);
        assertThat(config.terminator()).isSameAs(Terminator.THROW);
    }

    @Test
    void autoColor_offWithoutConsoleOrWithNoColor() {
        assertThat(IntrospectConfig.from(properties(), Map.of(), false).colorsEnabled()).isFalse();
        assertThat(IntrospectConfig.from(properties(), Map.of("NO_COLOR", "1"), true).colorsEnabled()).isFalse();
    }

    @Test
    void explicitColorMode_overridesEnvironment() {
        assertThat(IntrospectConfig.from(properties("introspect.color", "always"), Map.of("NO_COLOR", ""), false)
                .colorsEnabled()).isTrue();
        assertThat(IntrospectConfig.from(properties("introspect.color", "NEVER"), Map.of(), true)
                .colorsEnabled()).isFalse();
    }

    @Test
    void haltAbortMode_selectsHaltTerminator() {
        IntrospectConfig config = IntrospectConfig.from(properties("introspect.abort", "halt"), Map.of(), false);

        assertThat(config.terminator()).isSameAs(Terminator.HALT);
    }

    @Test
    void unknownValue_isRejected() {
        assertThatThrownBy(() -> IntrospectConfig.from(properties("introspect.color", "sometimes"), Map.of(), true))
                .isInstanceOf(IntrospectException.class)
                .hasMessageContaining("sometimes")
                .hasMessageContaining("introspect.color");
    }
}
