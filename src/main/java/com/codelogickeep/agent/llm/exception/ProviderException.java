package com.codelogickeep.agent.llm.exception;

/**
 * Unified exception for every provider call failure.
 * Callers branch on {@link #getKind()}; the message, status and body exist for logging.
 * API keys never appear in the message.
 */
public class ProviderException extends RuntimeException {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    private final ErrorKind kind;
    private final String provider;
    private final Integer statusCode;
    private final String responseBody;

    public ProviderException(ErrorKind kind, String provider, String message) {
        this(kind, provider, message, null, null, null);
    }

    public ProviderException(ErrorKind kind, String provider, String message, Throwable cause) {
        this(kind, provider, message, null, null, cause);
    }

    private ProviderException(ErrorKind kind, String provider, String message,
                              Integer statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    private ProviderException(Builder builder) {
        this(builder.kind, builder.provider, builder.message,
                builder.statusCode, builder.responseBody, builder.cause);
    }

    public static Builder builder(ErrorKind kind, String provider, String message) {
        return new Builder(kind, provider, message);
    }

    /**
     * Maps a non-success HTTP status to its error kind.
     * 401 and 429 have dedicated kinds; every other status keeps its code and body.
     */
    public static ProviderException fromStatus(String provider, int statusCode, String body) {
        ErrorKind kind = switch (statusCode) {
            case 401 -> ErrorKind.AUTHENTICATION_FAILURE;
            case 429 -> ErrorKind.RATE_LIMIT_EXCEEDED;
            default -> ErrorKind.HTTP_FAILURE;
        };
        String message = switch (kind) {
            case AUTHENTICATION_FAILURE -> provider + " API authentication failed: invalid API key";
            case RATE_LIMIT_EXCEEDED -> provider + " API rate limit exceeded";
            default -> provider + " API HTTP " + statusCode + " error: " + truncate(body);
        };
        return builder(kind, provider, message)
                .statusCode(statusCode)
                .responseBody(body)
                .build();
    }

    public static ProviderException timeout(String provider, Throwable cause) {
        return new ProviderException(ErrorKind.TIMEOUT, provider,
                provider + " API request timeout: " + cause.getMessage(), cause);
    }

    public static ProviderException connectionFailure(String provider, Throwable cause) {
        return new ProviderException(ErrorKind.CONNECTION_FAILURE, provider,
                provider + " API connection error: " + cause.getMessage(), cause);
    }

    public static ProviderException deserializationFailure(String provider, String body, Throwable cause) {
        return builder(ErrorKind.DESERIALIZATION_FAILURE, provider,
                "Failed to deserialize " + provider + " response: "
                        + (cause != null ? cause.getMessage() : truncate(body)))
                .responseBody(body)
                .cause(cause)
                .build();
    }

    public static ProviderException emptyResponse(String provider, String detail) {
        return new ProviderException(ErrorKind.EMPTY_RESPONSE, provider,
                provider + " response contained no " + detail);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * HTTP status, null when the failure happened before a response arrived
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * Human-readable description recorded as step output.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(kind.getCode()).append("] ").append(kind.name());
        if (provider != null) {
            sb.append(" from ").append(provider);
        }
        sb.append(": ").append(getMessage());
        if (statusCode != null && kind == ErrorKind.HTTP_FAILURE) {
            sb.append(" (status ").append(statusCode).append(")");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }

    private static String truncate(String body) {
        if (body == null) {
            return "(no body)";
        }
        return body.length() > MAX_BODY_IN_MESSAGE
                ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..."
                : body;
    }

    public static class Builder {
        private final ErrorKind kind;
        private final String provider;
        private final String message;
        private Integer statusCode;
        private String responseBody;
        private Throwable cause;

        private Builder(ErrorKind kind, String provider, String message) {
            this.kind = kind;
            this.provider = provider;
            this.message = message;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder responseBody(String responseBody) {
            this.responseBody = responseBody;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public ProviderException build() {
            return new ProviderException(this);
        }
    }

    /**
     * Closed set of failure kinds shared by every provider.
     */
    public enum ErrorKind {
        TIMEOUT("P001", "Request exceeded the configured timeout"),
        CONNECTION_FAILURE("P002", "Could not reach the provider endpoint"),
        AUTHENTICATION_FAILURE("P003", "Provider rejected the credentials"),
        RATE_LIMIT_EXCEEDED("P004", "Provider reported too many requests"),
        HTTP_FAILURE("P005", "Provider returned a non-success HTTP status"),
        DESERIALIZATION_FAILURE("P006", "Response body did not match the expected schema"),
        EMPTY_RESPONSE("P007", "Response contained no usable content");

        private final String code;
        private final String description;

        ErrorKind(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }
}
