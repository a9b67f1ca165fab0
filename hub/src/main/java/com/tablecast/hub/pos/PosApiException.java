package com.tablecast.hub.pos;

import lombok.Getter;

/**
 * Non-success answer from the POS API, or a token that could not be obtained.
 */
@Getter
public class PosApiException extends RuntimeException {

    /**
     * HTTP status returned by the POS, 0 when no response was read.
     */
    private final int status;

    public PosApiException(String message, int status) {
        super(message);
        this.status = status;
    }

    public PosApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }
}
