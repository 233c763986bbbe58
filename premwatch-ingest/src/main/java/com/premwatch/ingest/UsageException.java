package com.premwatch.ingest;

/**
 * Bad command line.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
