package com.williamcallahan.contextbudget.service;

import com.williamcallahan.contextbudget.domain.trim.TrimMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Publishes the latest trim's compression ratio and semantic retention as gauges.
 *
 * <p>An unset retention score is published as NaN so scrapers see the series as absent.</p>
 */
@Component
public class TrimMetricsRecorder {

    static final String COMPRESS_RATIO_GAUGE = "compress_ratio";
    static final String SEMANTIC_RETENTION_GAUGE = "semantic_retention";

    private final AtomicLong compressRatioBits = new AtomicLong(Double.doubleToLongBits(1.0));
    private final AtomicLong semanticRetentionBits = new AtomicLong(Double.doubleToLongBits(Double.NaN));

    public TrimMetricsRecorder(MeterRegistry meterRegistry) {
        Gauge.builder(COMPRESS_RATIO_GAUGE, compressRatioBits, bits -> Double.longBitsToDouble(bits.get()))
                .description("Ratio of tokens kept after trimming")
                .register(meterRegistry);
        Gauge.builder(SEMANTIC_RETENTION_GAUGE, semanticRetentionBits, bits -> Double.longBitsToDouble(bits.get()))
                .description("Semantic retention score for trimmed context")
                .register(meterRegistry);
    }

    /**
     * Records the metrics of the most recent trim.
     *
     * @param metrics metrics of the trim that just completed
     */
    public void observe(TrimMetrics metrics) {
        Double retention = metrics.semanticRetention();
        compressRatioBits.set(Double.doubleToLongBits(metrics.compressRatio()));
        semanticRetentionBits.set(Double.doubleToLongBits(retention == null ? Double.NaN : retention));
    }

    /**
     * Returns the current gauge values; a missing retention score is reported as null.
     *
     * @return gauge name to latest value
     */
    public Map<String, Double> snapshot() {
        double retention = Double.longBitsToDouble(semanticRetentionBits.get());
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(COMPRESS_RATIO_GAUGE, Double.longBitsToDouble(compressRatioBits.get()));
        values.put(SEMANTIC_RETENTION_GAUGE, Double.isNaN(retention) ? null : retention);
        return values;
    }
}
