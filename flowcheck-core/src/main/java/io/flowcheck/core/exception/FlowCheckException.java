package io.flowcheck.core.exception;

import java.io.Serial;

/// Base class for all failures raised while compiling conditions or analysing a flow graph.
///
/// Every failure is deterministic: the analysis operates on immutable inputs, so
/// repeating a failed call without changing its input reproduces the same exception.
///
/// @see ConfigurationException
/// @see TypeMismatchException
/// @see SemanticException
public class FlowCheckException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3311942671088017304L;

    public FlowCheckException(String message) {
        super(message);
    }

    public FlowCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
