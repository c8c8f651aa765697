package com.csd.pkginspect.exception;

/**
 * Root of every failure raised by the inspection engine.
 */
public class PkgInspectException extends RuntimeException {

    public PkgInspectException(String message) {
        super(message);
    }

    public PkgInspectException(String message, Throwable cause) {
        super(message, cause);
    }
}
