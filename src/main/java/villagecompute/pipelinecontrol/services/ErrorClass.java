package villagecompute.pipelinecontrol.services;

import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

import jakarta.persistence.QueryTimeoutException;

import villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException;
import villagecompute.pipelinecontrol.exceptions.ResourceExhaustedException;
import villagecompute.pipelinecontrol.exceptions.TransientBackendException;
import villagecompute.pipelinecontrol.exceptions.ValidationException;

/**
 * Classification of a run failure, deciding retry eligibility.
 *
 * <p>
 * Exception types are checked first along the cause chain. When no type matches, the message is searched for
 * well-known markers, which also covers runs whose error was recorded as text only.
 */
public enum ErrorClass {

    TRANSIENT, TIMEOUT, RESOURCE_EXHAUSTED, VALIDATION, CONFIGURATION, UNKNOWN;

    private static final int MAX_CAUSE_DEPTH = 10;

    /**
     * Classifies an exception by type along its cause chain, then by message.
     */
    public static ErrorClass classify(Throwable error) {
        if (error == null) {
            return UNKNOWN;
        }
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            ErrorClass byType = byType(current);
            if (byType != null) {
                return byType;
            }
            current = current.getCause();
        }
        return classify(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
    }

    /**
     * Classifies a recorded error message.
     */
    public static ErrorClass classify(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("validationerror") || lower.contains("invalid") || lower.contains("malformed")) {
            return VALIDATION;
        }
        if (lower.contains("not configured") || lower.contains("no executor") || lower.contains("unknown tenant")) {
            return CONFIGURATION;
        }
        if (lower.contains("resource exhausted") || lower.contains("concurrency limit")) {
            return RESOURCE_EXHAUSTED;
        }
        if (lower.contains("timeout") || lower.contains("timed out") || lower.contains("deadline exceeded")) {
            return TIMEOUT;
        }
        if (lower.contains("connection") || lower.contains("unavailable") || lower.contains("temporar")) {
            return TRANSIENT;
        }
        return UNKNOWN;
    }

    private static ErrorClass byType(Throwable error) {
        if (error instanceof ValidationException) {
            return VALIDATION;
        }
        if (error instanceof PipelineConfigurationException) {
            return CONFIGURATION;
        }
        if (error instanceof ResourceExhaustedException) {
            return RESOURCE_EXHAUSTED;
        }
        if (error instanceof TimeoutException || error instanceof SQLTimeoutException
                || error instanceof QueryTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof TransientBackendException || error instanceof SQLTransientException) {
            return TRANSIENT;
        }
        return null;
    }
}
