package com.traceradar.config;

import com.traceradar.domain.AccountId;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the monitored account set: from accounts-file when it is readable, otherwise from the
 * accounts list in configuration.
 */
@Slf4j
public final class MonitoredAccountsLoader {

    private static final String DEFAULT_ACCOUNTS_FILE = "accounts.txt";

    private MonitoredAccountsLoader() {
    }

    public static MonitoredAccounts load(TraceRadarProperties properties) {
        Optional<List<AccountId>> fromFile = readAccountsFile(properties.getAccountsFile());
        if (fromFile.isPresent()) {
            return new MonitoredAccounts(fromFile.get());
        }
        log.info("Using accounts from configuration: {} entries", properties.getAccounts().size());
        return new MonitoredAccounts(parseConfigured(properties.getAccounts()));
    }

    /**
     * Configured entries must all be valid; a bad one fails startup.
     */
    static List<AccountId> parseConfigured(List<String> entries) {
        List<AccountId> accounts = new ArrayList<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            accounts.add(AccountId.parse(entry));
        }
        return accounts;
    }

    /**
     * Empty when the file cannot be opened or read. Invalid lines are skipped with a warning.
     */
    static Optional<List<AccountId>> readAccountsFile(String file) {
        String name = file == null || file.isBlank() ? DEFAULT_ACCOUNTS_FILE : file;
        Path path = Path.of(name);
        if (!Files.isReadable(path)) {
            log.warn("Failed to load accounts from file '{}': not readable", name);
            return Optional.empty();
        }
        log.info("Loading accounts from file '{}'...", name);
        List<AccountId> accounts = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String address = line.split(",", 2)[0].trim();
                if (address.isEmpty()) {
                    continue;
                }
                Optional<AccountId> account = AccountId.tryParse(address);
                if (account.isEmpty()) {
                    log.warn("Skipping invalid account '{}' in {}", address, name);
                    continue;
                }
                accounts.add(account.get());
            }
        } catch (IOException e) {
            log.warn("Failed to load accounts from file '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
        log.info("Finished loading {} accounts from file '{}'", accounts.size(), name);
        return Optional.of(accounts);
    }
}
