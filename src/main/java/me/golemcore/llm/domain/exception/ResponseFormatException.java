package me.golemcore.llm.domain.exception;

/**
 * Model output contained no recoverable JSON object.
 */
public class ResponseFormatException extends LlmException {

    private static final long serialVersionUID = 1L;

    private final String rawText;

    public ResponseFormatException(String message, String rawText) {
        super(message);
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }
}
