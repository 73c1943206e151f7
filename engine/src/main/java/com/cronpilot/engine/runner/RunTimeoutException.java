package com.cronpilot.engine.runner;

/** The executor call outlived the job's maxRunSeconds and was cancelled. */
public class RunTimeoutException extends RuntimeException {

    public static final String CODE = "TIMEOUT";

    private final int limitSeconds;

    public RunTimeoutException(int limitSeconds) {
        super("Run exceeded maxRunSeconds=" + limitSeconds);
        this.limitSeconds = limitSeconds;
    }

    public int getLimitSeconds() { return limitSeconds; }
}
