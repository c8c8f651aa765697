package com.csd.pkginspect.exception;

public class DiscoveryException extends PkgInspectException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
