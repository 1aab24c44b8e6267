package com.traceradar.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Beans derived from {@link TraceRadarProperties} at startup.
 */
@Configuration
@EnableConfigurationProperties(TraceRadarProperties.class)
@Slf4j
public class AppConfig {

    @Bean
    public MonitoredAccounts monitoredAccounts(TraceRadarProperties properties) {
        MonitoredAccounts accounts = MonitoredAccountsLoader.load(properties);
        log.info("Monitoring {} accounts", accounts.size());
        return accounts;
    }

    @Bean
    public UpstreamServers upstreamServers(TraceRadarProperties properties) {
        List<LiteServer> liteServers = LiteServer.parseList(properties.getLiteServers());
        List<LiteServer> sendingLiteServers = LiteServer.parseList(properties.getSendingLiteServers());
        log.info("Lite servers: {}, sending lite servers: {}", liteServers, sendingLiteServers);
        return new UpstreamServers(liteServers, sendingLiteServers, properties.isTestnet());
    }
}
