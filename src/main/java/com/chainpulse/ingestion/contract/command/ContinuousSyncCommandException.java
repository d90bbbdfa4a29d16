package com.chainpulse.ingestion.contract.command;

import lombok.Getter;

/**
 * Thrown when a continuous sync cannot be started or stopped.
 * The API layer maps USER_NOT_FOUND, NO_DEFAULT_CONTRACT and NO_ACTIVE_SYNC to 404, SYNC_ALREADY_RUNNING to 409.
 */
@Getter
public class ContinuousSyncCommandException extends RuntimeException {

    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";
    public static final String NO_DEFAULT_CONTRACT = "NO_DEFAULT_CONTRACT";
    public static final String NO_ACTIVE_SYNC = "NO_ACTIVE_SYNC";
    public static final String SYNC_ALREADY_RUNNING = "SYNC_ALREADY_RUNNING";

    private final String errorCode;

    public ContinuousSyncCommandException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
