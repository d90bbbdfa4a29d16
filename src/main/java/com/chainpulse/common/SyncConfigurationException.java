package com.chainpulse.common;

/**
 * Thrown when a sync target is misconfigured (missing chain, missing contract address, unsupported chain).
 * Retrying cannot fix it, so a continuous sync that hits it stops instead of retrying.
 */
public class SyncConfigurationException extends RuntimeException {

    public SyncConfigurationException(String message) {
        super(message);
    }
}
