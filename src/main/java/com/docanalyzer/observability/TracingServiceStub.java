package com.docanalyzer.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * No-op tracing used when Datadog is disabled, so callers never need null checks.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("com.docanalyzer");

    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        return operation.get();
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return tracer.spanBuilder(spanName);
    }
}
