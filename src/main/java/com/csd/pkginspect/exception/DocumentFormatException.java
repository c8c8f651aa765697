package com.csd.pkginspect.exception;

/**
 * A scraped document no longer has the structure the parsers rely on.
 */
public class DocumentFormatException extends PkgInspectException {

    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
