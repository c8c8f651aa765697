package com.csd.pkginspect.exception;

public class PreconditionFailedException extends PkgInspectException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
