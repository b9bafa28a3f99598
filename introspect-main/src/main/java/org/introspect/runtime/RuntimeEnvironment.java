package org.introspect.runtime;

import java.util.List;

/**
 * The program state an instrumented assertion runs against.
 */
public interface RuntimeEnvironment {

    Object read(String variable);

    Pointer addressOf(String variable);

    /**
     * The address of a string literal's storage. Equal literals may share storage.
     */
    Pointer stringLiteral(String value);

    Object call(String function, List<Object> arguments);

    /**
     * Evaluates an expression the engine keeps opaque, identified by its source text.
     */
    Object evaluateOpaque(String sourceText);
}
