package io.flowcheck.core.exception;

import java.io.Serial;

/// Raised for conditions that are well-typed but meaningless in their domain:
/// unknown identifiers, literals outside their enumeration, inequalities that no
/// enumeration member satisfies.
public class SemanticException extends FlowCheckException {

    @Serial private static final long serialVersionUID = -7433874180525620152L;

    public SemanticException(String message) {
        super(message);
    }

    public SemanticException(String message, Throwable cause) {
        super(message, cause);
    }
}
