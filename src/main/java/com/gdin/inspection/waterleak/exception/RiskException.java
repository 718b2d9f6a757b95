package com.gdin.inspection.waterleak.exception;

import lombok.Getter;

import java.util.Objects;

@Getter
public class RiskException extends RuntimeException {

    private final ErrorKind kind;

    public RiskException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public RiskException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String toString() {
        return "RiskException[" + kind + "]: " + getMessage();
    }
}
