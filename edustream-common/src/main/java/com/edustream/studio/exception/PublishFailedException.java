package com.edustream.studio.exception;

/**
 * The social platform rejected or failed a direct publish. Reported as a server error.
 */
public class PublishFailedException extends RuntimeException {
    public PublishFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
