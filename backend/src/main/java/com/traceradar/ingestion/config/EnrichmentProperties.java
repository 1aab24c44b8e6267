package com.traceradar.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Trace enrichment settings. Documented in application.yml under traceradar.enrichment.
 */
@ConfigurationProperties(prefix = "traceradar.enrichment")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class EnrichmentProperties {

    /** "mongo" resolves from the indexer collections; "none" disables enrichment (traces served bare). */
    @NotNull
    private Source source = Source.MONGO;

    /** Upper bound for the three batched lookups of one trace. Zero or null = no bound. */
    private Duration timeout = Duration.ofSeconds(5);

    @NotNull
    private CacheProperties cache = new CacheProperties();

    public enum Source {
        MONGO,
        NONE
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class CacheProperties {

        private boolean enabled = true;

        /** Sale prices and owners change; keep this short. */
        @NotNull
        private Duration ttl = Duration.ofSeconds(30);

        @Min(1)
        private long maximumSize = 50_000;
    }
}
