package org.introspect.recorder;

/**
 * One rewritten node: evaluates it against a frame, recording as it goes.
 */
@FunctionalInterface
interface Step {

    Object run(EvaluationFrame frame);
}
