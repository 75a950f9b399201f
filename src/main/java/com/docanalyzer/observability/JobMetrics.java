package com.docanalyzer.observability;

import com.docanalyzer.shared.repository.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Job lifecycle metrics.
 *
 * Metrics:
 * - docanalyzer.job.submitted: jobs accepted by the gateway
 * - docanalyzer.job.completed / docanalyzer.job.failed: terminal outcomes
 * - docanalyzer.job.skipped: deliveries ignored because the job was already claimed or finished
 * - docanalyzer.job.cleanup_failures: temp files that could not be removed
 * - docanalyzer.job.duration: wall time of a process invocation
 * - docanalyzer.job.backlog: PENDING jobs in the store
 */
@Service
public class JobMetrics {

    private static final String SERVICE_TAG = "document-analyzer";

    private final Counter submitted;
    private final Counter completed;
    private final Counter failed;
    private final Counter skipped;
    private final Counter cleanupFailures;
    private final Timer duration;

    public JobMetrics(MeterRegistry meterRegistry, JobStore jobStore) {
        this.submitted = counter(meterRegistry, "docanalyzer.job.submitted", "Jobs accepted for processing");
        this.completed = counter(meterRegistry, "docanalyzer.job.completed", "Jobs that produced a report");
        this.failed = counter(meterRegistry, "docanalyzer.job.failed", "Jobs that ended in FAILED");
        this.skipped = counter(meterRegistry, "docanalyzer.job.skipped", "Duplicate or stale deliveries ignored");
        this.cleanupFailures = counter(meterRegistry, "docanalyzer.job.cleanup_failures",
                "Temporary files that could not be deleted");
        this.duration = Timer.builder("docanalyzer.job.duration")
                .description("Job processing duration")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        Gauge.builder("docanalyzer.job.backlog", jobStore, JobStore::countPending)
                .description("Number of PENDING jobs")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tag("service", SERVICE_TAG)
                .register(registry);
    }

    public void recordSubmitted() {
        submitted.increment();
    }

    public void recordCompleted(long durationMs) {
        completed.increment();
        duration.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFailed(long durationMs) {
        failed.increment();
        duration.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordSkipped() {
        skipped.increment();
    }

    public void recordCleanupFailure() {
        cleanupFailures.increment();
    }
}
