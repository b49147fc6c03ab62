package dev.linguaroute.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Counters for translation lookups, fallbacks and writes.
 */
@Component
@RequiredArgsConstructor
public class TranslationMetrics {

    public static final String LOOKUPS = "translation.lookups";
    public static final String FALLBACKS = "translation.fallbacks";
    public static final String WRITES = "translation.writes";

    private final MeterRegistry meterRegistry;

    public void recordHit() {
        lookups("hit").increment();
    }

    public void recordFallback(String requestedLocale, String servedLocale) {
        lookups("fallback").increment();
        Counter.builder(FALLBACKS)
                .description("Lookups served in a locale other than the requested one")
                .tag("requested", requestedLocale)
                .tag("served", servedLocale)
                .register(meterRegistry)
                .increment();
    }

    public void recordMiss() {
        lookups("miss").increment();
    }

    public void recordWrite(String table) {
        meterRegistry.counter(WRITES, "table", table).increment();
    }

    private Counter lookups(String result) {
        return Counter.builder(LOOKUPS)
                .description("Translation lookups by outcome")
                .tag("result", result)
                .register(meterRegistry);
    }
}
