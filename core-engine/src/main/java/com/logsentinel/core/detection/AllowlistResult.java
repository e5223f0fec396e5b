package com.logsentinel.core.detection;

import java.util.Objects;

/**
 * Outcome of an administrative allowlist request.
 *
 * <p>
 * Administrative calls report problems through this value instead of
 * throwing, so a bad request can never disturb record processing.
 * </p>
 *
 * @since 1.0.0
 */
public final class AllowlistResult {

    private final boolean success;
    private final String message;

    private AllowlistResult(boolean success, String message) {
        this.success = success;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public static AllowlistResult success(String message) {
        return new AllowlistResult(true, message);
    }

    public static AllowlistResult failure(String message) {
        return new AllowlistResult(false, message);
    }

    public boolean isSuccess() {
        return success;
    }

    /** @return the confirmation text, or the error description on failure */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return (success ? "AllowlistResult{success, '" : "AllowlistResult{failure, '") + message + "'}";
    }
}
