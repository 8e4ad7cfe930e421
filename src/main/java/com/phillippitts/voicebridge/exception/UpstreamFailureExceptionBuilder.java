package com.phillippitts.voicebridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Fluent builder for upstream failures carrying structured diagnostic context.
 *
 * <p>The concrete exception type is chosen by the caller through a constructor reference, so the
 * same builder serves the subprocess bridge and both Wyoming clients.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw UpstreamFailureExceptionBuilder.create("Process exited during turn")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("sessionId", sessionId)
 *         .metadata("stderr", stderrTail)
 *         .build(ProcessFailureException::new);
 *
 * throw UpstreamFailureExceptionBuilder.create("Connection refused")
 *         .cause(ioException)
 *         .metadata("endpoint", "tcp://localhost:10300")
 *         .build(TranscriptionException::new);
 * </pre>
 */
public final class UpstreamFailureExceptionBuilder {

    private final String message;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private UpstreamFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static UpstreamFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new UpstreamFailureExceptionBuilder(message);
    }

    public UpstreamFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public UpstreamFailureExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public UpstreamFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public UpstreamFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @param factory constructor of the concrete failure type taking (message, cause)
     * @param <T> concrete failure type
     * @return constructed exception
     */
    public <T extends UpstreamFailureException> T build(BiFunction<String, Throwable, T> factory) {
        Objects.requireNonNull(factory, "factory");
        return factory.apply(buildDetailedMessage(), cause);
    }

    String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        return sb.append(')').toString();
    }
}
