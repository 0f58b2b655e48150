package io.flowcheck.core.exception;

import java.io.Serial;

/// Raised when operand kinds violate an operator signature, e.g. a number symbol
/// compared to a string literal.
public class TypeMismatchException extends FlowCheckException {

    @Serial private static final long serialVersionUID = 6050177306310940985L;

    public TypeMismatchException(String message) {
        super(message);
    }
}
