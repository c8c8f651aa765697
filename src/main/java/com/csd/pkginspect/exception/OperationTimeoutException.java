package com.csd.pkginspect.exception;

public class OperationTimeoutException extends PkgInspectException {

    public OperationTimeoutException(String message) {
        super(message);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
