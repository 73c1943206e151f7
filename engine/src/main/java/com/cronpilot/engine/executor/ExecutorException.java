package com.cronpilot.engine.executor;

/**
 * Thrown when the graph executor returns an error or is unreachable.
 *
 * {@code code} ends up as the run's errorCode; {@code transientFailure}
 * marks errors that are worth retrying when the job's retry policy lists
 * no explicit codes (network failures, HTTP 429 and 5xx).
 */
public class ExecutorException extends RuntimeException {

    public static final String NETWORK      = "NETWORK";
    public static final String INTERRUPTED  = "INTERRUPTED";
    public static final String BAD_RESPONSE = "BAD_RESPONSE";

    private final String  code;
    private final boolean transientFailure;

    public ExecutorException(String code, String message, boolean transientFailure) {
        super(message);
        this.code             = code;
        this.transientFailure = transientFailure;
    }

    public ExecutorException(String code, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.code             = code;
        this.transientFailure = transientFailure;
    }

    /** Error for a non-2xx response. 429 and 5xx are transient. */
    public static ExecutorException forStatus(int status, String message) {
        boolean retryable = status == 429 || status >= 500;
        return new ExecutorException("HTTP_" + status, message, retryable);
    }

    public String  getCode()            { return code; }
    public boolean isTransientFailure() { return transientFailure; }
}
