package io.flowcheck.core.exception;

import java.io.Serial;

/// Raised for structural mistakes that make an analysis run impossible: a handler tag
/// registered twice, a cycle in the transition graph, an empty enumeration, or a node
/// predicate that cannot be resolved.
public class ConfigurationException extends FlowCheckException {

    @Serial private static final long serialVersionUID = -2201906123565436521L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
