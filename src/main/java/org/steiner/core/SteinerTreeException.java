package org.steiner.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure raised by {@link SteinerTreeCore#compute} for a request it cannot turn into a tree.
 *
 * <p>{@link #getReasonCode()} is one of the {@code SteinerTreeCore.REASON_*} constants and is
 * stable across releases, so callers branch on it rather than on the message. The message
 * itself reads {@code [REASON_CODE] detail}. Guardrail failures from the search engine keep
 * the engine exception as cause.</p>
 */
@Getter
public final class SteinerTreeException extends RuntimeException {
    private final String reasonCode;

    public SteinerTreeException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * @param reasonCode non-blank reason code.
     * @param message detail appended after the code.
     * @param cause engine exception that triggered the failure, or null.
     */
    public SteinerTreeException(String reasonCode, String message, Throwable cause) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    private static String checkedCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
