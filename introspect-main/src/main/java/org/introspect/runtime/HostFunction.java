package org.introspect.runtime;

import java.util.List;

/**
 * A function the condition calls. Arguments arrive already converted to the
 * parameter types of its prototype.
 */
@FunctionalInterface
public interface HostFunction {

    Object invoke(List<Object> arguments);
}
