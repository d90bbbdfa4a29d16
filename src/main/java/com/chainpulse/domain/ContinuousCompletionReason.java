package com.chainpulse.domain;

/**
 * Why a continuous sync ended, as recorded on the user's default contract.
 */
public enum ContinuousCompletionReason {
    AUTO_STOPPED_NO_DATA("auto-stopped-no-data"),
    MAX_CYCLES_REACHED("max-cycles-reached"),
    NORMAL_COMPLETION("normal-completion"),
    USER_REQUESTED("user_requested");

    private final String code;

    ContinuousCompletionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
