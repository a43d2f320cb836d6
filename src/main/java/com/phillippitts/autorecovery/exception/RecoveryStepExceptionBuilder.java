package com.phillippitts.autorecovery.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link RecoveryStepException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw RecoveryStepExceptionBuilder.create("Step timed out")
 *         .step(4, "Start Service")
 *         .attempt(2)
 *         .durationMs(10_000)
 *         .metadata("service", "cache")
 *         .build();
 * </pre>
 *
 * <p>Resulting message: {@code Step timed out (attempt=2, durationMs=10000, service=cache)}.
 */
public final class RecoveryStepExceptionBuilder {

    private final String message;
    private int stepIndex;
    private String stepName = "unknown";
    private Throwable cause;
    private Integer attempt;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RecoveryStepExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static RecoveryStepExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RecoveryStepExceptionBuilder(message);
    }

    public RecoveryStepExceptionBuilder step(int stepIndex, String stepName) {
        this.stepIndex = stepIndex;
        this.stepName = stepName;
        return this;
    }

    public RecoveryStepExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public RecoveryStepExceptionBuilder attempt(int attempt) {
        this.attempt = attempt;
        return this;
    }

    public RecoveryStepExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Adds a key-value pair; null keys or values are ignored. */
    public RecoveryStepExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public RecoveryStepException build() {
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new RecoveryStepException(detailed, stepIndex, stepName, cause);
        }
        return new RecoveryStepException(detailed, stepIndex, stepName);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (attempt != null) {
            details.put("attempt", String.valueOf(attempt));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
