package com.cronpilot.engine.runner;

import com.cronpilot.engine.executor.ExecutorException;
import com.cronpilot.engine.model.RetryPolicy;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps a failed run's exception to an error code and decides whether it is
 * worth another attempt.
 *
 * A code listed in the job's retryableCodes is always retryable. Anything
 * else is retryable only if it looks transient: timeouts, network and I/O
 * errors, and executor errors flagged as transient (HTTP 429 / 5xx).
 */
@Component
public class FailureClassifier {

    public static final String ABANDONED = "ABANDONED";
    public static final String IO_ERROR  = "IO_ERROR";

    public record Failure(String code, String message, boolean retryable) {}

    public Failure classify(Throwable error, RetryPolicy policy) {
        Throwable e = unwrap(error);
        String code = codeOf(e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        boolean retryable = policy.isRetryableCode(code) || isTransient(e);
        return new Failure(code, message, retryable);
    }

    /** A run whose worker disappeared; treated like a transient failure. */
    public Failure abandoned(String message) {
        return new Failure(ABANDONED, message, true);
    }

    static String codeOf(Throwable e) {
        if (e instanceof RunTimeoutException) return RunTimeoutException.CODE;
        if (e instanceof ExecutorException ex) return ex.getCode();
        if (e instanceof IOException || e instanceof UncheckedIOException) return IO_ERROR;
        return e.getClass().getSimpleName();
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof RunTimeoutException) return true;
        if (e instanceof ExecutorException ex && ex.isTransientFailure()) return true;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof UncheckedIOException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
