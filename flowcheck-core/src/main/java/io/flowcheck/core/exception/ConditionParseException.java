package io.flowcheck.core.exception;

import java.io.Serial;

/// Raised when condition text does not match the condition grammar.
public class ConditionParseException extends FlowCheckException {

    @Serial private static final long serialVersionUID = 1906217734093122840L;

    private final int position;

    public ConditionParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /// Returns the zero-based character offset where parsing failed.
    ///
    /// @return offset into the condition text
    public int getPosition() {
        return position;
    }
}
