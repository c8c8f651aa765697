package com.csd.pkginspect.exception;

/**
 * A runtime, package, field or history version could not be resolved locally.
 */
public class NotFoundException extends PkgInspectException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
