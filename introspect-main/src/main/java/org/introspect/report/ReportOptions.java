package org.introspect.report;

import org.introspect.IntrospectConfig;
import org.introspect.render.Palette;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Where and how failure reports are written.
 */
public final class ReportOptions {

    private final boolean colors;
    private final PrintStream out;
    private final Terminator terminator;
    private final Palette palette;

    private ReportOptions(Builder builder) {
        this.colors = builder.colors;
        this.out = builder.out;
        this.terminator = builder.terminator;
        this.palette = builder.palette;
    }

    /**
     * Options taken from the {@code introspect.*} system properties, writing to
     * standard error.
     */
    public static ReportOptions defaults() {
        IntrospectConfig config = IntrospectConfig.fromSystem();
        return builder()
                .colors(config.colorsEnabled())
                .terminator(config.terminator())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isColors() {
        return colors;
    }

    public PrintStream getOut() {
        return out;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    public Palette getPalette() {
        return palette;
    }

    public static final class Builder {

        private boolean colors;
        private PrintStream out = System.err;
        private Terminator terminator = Terminator.THROW;
        private Palette palette = Palette.DEFAULT;

        private Builder() {
        }

        public Builder colors(boolean colors) {
            this.colors = colors;
            return this;
        }

        public Builder out(PrintStream out) {
            this.out = Objects.requireNonNull(out, "out");
            return this;
        }

        /**
         * Writes UTF-8 to {@code out} through an auto-flushing stream.
         */
        public Builder out(OutputStream out) {
            return out(new PrintStream(Objects.requireNonNull(out, "out"), true, StandardCharsets.UTF_8));
        }

        public Builder terminator(Terminator terminator) {
            this.terminator = Objects.requireNonNull(terminator, "terminator");
            return this;
        }

        public Builder palette(Palette palette) {
            this.palette = Objects.requireNonNull(palette, "palette");
            return this;
        }

        public ReportOptions build() {
            return new ReportOptions(this);
        }
    }
}
