package com.autonomous.quota.exception;

/**
 * The pricing source could not be read or has fewer than a header and one data row.
 */
public class PriceCatalogLoadException extends Exception {

    public PriceCatalogLoadException(String message) {
        super(message);
    }

    public PriceCatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
