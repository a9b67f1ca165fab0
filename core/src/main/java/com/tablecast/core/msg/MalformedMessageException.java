package com.tablecast.core.msg;

/**
 * Raised when an inbound client message cannot be parsed or lacks a field its type requires.
 * <p>
 * Caught at the per-message boundary: the message is dropped, the connection stays open.
 * </p>
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
