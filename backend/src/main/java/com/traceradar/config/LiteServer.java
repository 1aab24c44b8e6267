package com.traceradar.config;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Upstream lite server endpoint: host, port and base64 ed25519 public key.
 */
public record LiteServer(String host, int port, String key) {

    private static final int KEY_LENGTH = 32;

    /**
     * Parses "ip:port:base64key" entries.
     *
     * @throws IllegalArgumentException on a malformed entry
     */
    public static List<LiteServer> parseList(List<String> entries) {
        List<LiteServer> servers = new ArrayList<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            servers.add(parse(entry.trim()));
        }
        return servers;
    }

    public static LiteServer parse(String entry) {
        String[] parts = entry.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Lite server must be ip:port:key, got " + entry);
        }
        int port;
        try {
            port = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid lite server port in " + entry, e);
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("Invalid lite server port in " + entry);
        }
        byte[] key;
        try {
            key = Base64.getDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid lite server key in " + entry, e);
        }
        if (key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Lite server key must be 32 bytes in " + entry);
        }
        return new LiteServer(parts[0], port, parts[2]);
    }

    /** Host and port only; the key is not logged. */
    @Override
    public String toString() {
        return host + ":" + port;
    }
}
