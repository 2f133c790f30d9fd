package me.golemcore.llm.domain.exception;

/**
 * Cooperative cancellation was observed.
 */
public class CancelledException extends LlmException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public CancelledException(String reason) {
        super(reason != null && !reason.isBlank() ? "Cancelled: " + reason : "Cancelled");
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
