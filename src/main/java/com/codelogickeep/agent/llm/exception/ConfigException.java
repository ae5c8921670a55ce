package com.codelogickeep.agent.llm.exception;

/**
 * Raised when the LLM configuration is missing or invalid.
 * Thrown before any provider is constructed.
 */
public class ConfigException extends RuntimeException {

    private final String context;

    public ConfigException(String message, String context) {
        super(message);
        this.context = context;
    }

    public ConfigException(String message, String context, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    public String getContext() {
        return context;
    }

    @Override
    public String toString() {
        if (context == null || context.isEmpty()) {
            return "CONFIG ERROR: " + getMessage();
        }
        return "CONFIG ERROR: " + getMessage() + "\nContext: " + context;
    }
}
