package io.chainrelay.model;

import java.util.Map;

public final class OperatorException extends RuntimeException {
    private final OperatorError error;

    public OperatorException(OperatorError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public OperatorException(OperatorError error, Throwable cause) {
        super(error.code() + ": " + error.message(), cause);
        this.error = error;
    }

    public OperatorException(ErrorCode code, String message) {
        this(OperatorError.of(code, message));
    }

    public OperatorException(ErrorCode code, String message, Map<String, Object> details) {
        this(OperatorError.of(code, message, details));
    }

    public OperatorError error() {
        return error;
    }

    public ErrorCode code() {
        return error.code();
    }
}
