package com.csd.pkginspect.exception;

/**
 * A remote attempt did not complete within its timeout. Connection drops are retried
 * internally and never reach callers as this exception.
 */
public class TransientNetworkException extends PkgInspectException {

    private final String url;

    public TransientNetworkException(String message, String url, Throwable cause) {
        super(message + " (" + url + ")", cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
