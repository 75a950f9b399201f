package com.docanalyzer.observability;

import com.docanalyzer.util.Strings;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Interface for tracing service to support both enabled and disabled modes.
 */
public interface TracingServiceInterface {
    <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation);
    @Nonnull SpanBuilder spanBuilder(@Nonnull String spanName);

    /**
     * Marks a span as failed and records the exception on it.
     */
    default void recordFailure(@Nonnull Span span, @Nonnull Throwable error) {
        span.recordException(error);
        span.setAttribute("error", true);
        span.setAttribute("error.message", Strings.safe(error.getMessage()));
    }
}
