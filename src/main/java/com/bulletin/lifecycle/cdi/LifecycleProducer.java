package com.bulletin.lifecycle.cdi;

import com.bulletin.lifecycle.api.EntityLifecycle;
import com.bulletin.lifecycle.api.LifecycleConfig;
import com.bulletin.lifecycle.audit.AuditService;
import com.bulletin.lifecycle.cache.CacheConfig;
import com.bulletin.lifecycle.metrics.MetricsService;
import com.bulletin.lifecycle.metrics.MicrometerMetricsService;
import com.bulletin.lifecycle.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * CDI producer that wires the entity lifecycle library from MicroProfile Config properties.
 *
 * <pre>
 * entity-lifecycle:
 *   progenitor-agent-key: uhCAk...
 *   max-suspension-days: 365
 *   cache:
 *     enabled: true
 *     max-size: 10000
 *     ttl-seconds: 60
 * </pre>
 *
 * <p>If the container exposes a Micrometer {@link MeterRegistry}, metrics are
 * recorded into it.</p>
 */
@ApplicationScoped
public class LifecycleProducer {

    private static final Logger log = LoggerFactory.getLogger(LifecycleProducer.class);

    // ── Administration ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-lifecycle.progenitor-agent-key")
    Optional<String> progenitorAgentKey;

    @Inject
    @ConfigProperty(name = "entity-lifecycle.max-suspension-days", defaultValue = "365")
    int maxSuspensionDays;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-lifecycle.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "entity-lifecycle.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "entity-lifecycle.cache.ttl-seconds", defaultValue = "60")
    int cacheTtlSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public AuditService auditService() {
        return new AuditService();
    }

    @Produces
    @ApplicationScoped
    public EntityLifecycle entityLifecycle(AuditService auditService) {
        LifecycleConfig config = lifecycleConfig();
        log.info("Producing EntityLifecycle: maxSuspensionDays={} cacheEnabled={} progenitorConfigured={}",
                config.maxSuspensionDays(), config.cacheConfig().enabled(), config.progenitorAgentKey() != null);

        return EntityLifecycle.builder()
                .config(config)
                .auditService(auditService)
                .metricsService(metricsService())
                .build();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    LifecycleConfig lifecycleConfig() {
        CacheConfig cacheConfig = cacheEnabled
                ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                : CacheConfig.disabled();
        String progenitor = progenitorAgentKey != null
                ? progenitorAgentKey.filter(key -> !key.isBlank()).orElse(null)
                : null;
        return new LifecycleConfig(progenitor, maxSuspensionDays, cacheConfig);
    }

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Micrometer registry found, recording lifecycle metrics");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("No Micrometer registry available, metrics disabled");
        return new NoOpMetricsService();
    }
}
