package com.gatekeeper.service;

import com.gatekeeper.model.LimitDimension;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry registry;

    // ─── Per-dimension decisions ──────────────────────────────────────
    public void recordCheck(LimitDimension dimension, boolean allowed) {
        registry.counter("gatekeeper.checks.total",
                "dimension", dimension.label(),
                "result", allowed ? "allowed" : "denied")
                .increment();
    }

    // ─── Whole admission decision ─────────────────────────────────────
    public void recordDecision(LimitDimension reason, long latencyMicros) {
        registry.counter("gatekeeper.decisions.total",
                "reason", reason.label())
                .increment();

        registry.timer("gatekeeper.check.duration")
                .record(latencyMicros, TimeUnit.MICROSECONDS);
    }

    // ─── Storage failures (request was let through or rejected per fail mode) ─
    public void recordError(LimitDimension dimension) {
        registry.counter("gatekeeper.errors",
                "dimension", dimension.label())
                .increment();
    }

    // ─── DoS gate ─────────────────────────────────────────────────────
    public void recordDosBlock() {
        registry.counter("gatekeeper.dos.blocks").increment();
    }
}
