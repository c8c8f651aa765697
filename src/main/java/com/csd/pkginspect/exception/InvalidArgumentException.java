package com.csd.pkginspect.exception;

public class InvalidArgumentException extends PkgInspectException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
