package com.traceradar.ingestion.config;

import com.traceradar.domain.JettonWalletRepository;
import com.traceradar.domain.NftSaleRepository;
import com.traceradar.ingestion.pipeline.enrichment.InformationSource;
import com.traceradar.ingestion.source.CachingInformationSource;
import com.traceradar.ingestion.source.MongoInformationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the InformationSource used for trace enrichment. With traceradar.enrichment.source=none
 * no bean is created and enrichment runs in degraded (no-op) mode.
 */
@Configuration
@EnableConfigurationProperties(EnrichmentProperties.class)
@Slf4j
public class EnrichmentSourceConfig {

    @Bean
    @ConditionalOnProperty(prefix = "traceradar.enrichment", name = "source", havingValue = "mongo", matchIfMissing = true)
    public InformationSource informationSource(JettonWalletRepository jettonWalletRepository,
                                               NftSaleRepository nftSaleRepository,
                                               EnrichmentProperties properties) {
        InformationSource mongo = new MongoInformationSource(jettonWalletRepository, nftSaleRepository);
        EnrichmentProperties.CacheProperties cache = properties.getCache();
        if (!cache.isEnabled()) {
            log.info("Trace enrichment: mongo source, cache disabled");
            return mongo;
        }
        log.info("Trace enrichment: mongo source, cache ttl={} maxSize={}", cache.getTtl(), cache.getMaximumSize());
        return new CachingInformationSource(mongo, cache.getTtl(), cache.getMaximumSize());
    }
}
