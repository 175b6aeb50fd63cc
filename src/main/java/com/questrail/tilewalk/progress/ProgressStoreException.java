package com.questrail.tilewalk.progress;

/**
 * Progress could not be read from or written to its backing storage.
 */
public final class ProgressStoreException extends RuntimeException
{
    public ProgressStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
