package com.gdin.inspection.waterleak.exception;

public class MalformedInputException extends RiskException {

    public MalformedInputException(String message) {
        super(ErrorKind.MALFORMED_INPUT, message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_INPUT, message, cause);
    }
}
