package com.traceradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide settings. Documented in application.yml under traceradar; every key can be set from
 * the environment (TRACERADAR_ACCOUNTS, TRACERADAR_ACCOUNTS_FILE, TRACERADAR_LITE_SERVERS, ...).
 */
@ConfigurationProperties(prefix = "traceradar")
@NoArgsConstructor
@Getter
@Setter
public class TraceRadarProperties {

    /** Fallback allow-list, used when accounts-file cannot be read. */
    private List<String> accounts = new ArrayList<>(List.of(
            "0:0e41dc1dc3c9067ed24248580e12b3359818d83dee0304fabcf80845eafafdb2"));

    /** One address per line; anything after the first comma is ignored. */
    private String accountsFile = "accounts.txt";

    /** Lite servers for reading, "ip:port:base64key". */
    private List<String> liteServers = new ArrayList<>();

    /** Lite servers for sending external messages, "ip:port:base64key". */
    private List<String> sendingLiteServers = new ArrayList<>();

    private boolean testnet;

    public void setAccounts(List<String> accounts) {
        this.accounts = accounts != null ? accounts : new ArrayList<>();
    }

    public void setLiteServers(List<String> liteServers) {
        this.liteServers = liteServers != null ? liteServers : new ArrayList<>();
    }

    public void setSendingLiteServers(List<String> sendingLiteServers) {
        this.sendingLiteServers = sendingLiteServers != null ? sendingLiteServers : new ArrayList<>();
    }
}
