package me.golemcore.llm.domain.exception;

/**
 * The caller supplied a request the engine cannot run.
 */
public class InvalidRequestException extends LlmException {

    private static final long serialVersionUID = 1L;

    public InvalidRequestException(String message) {
        super(message);
    }
}
