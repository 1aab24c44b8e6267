package com.traceradar.domain;

import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TON account address: workchain + 256-bit account hash.
 * Accepts the raw form ({@code 0:83df...}) and the 48-char user-friendly form (base64 or base64url,
 * bounceable or not, mainnet or testnet). {@link #toString()} is the raw form with lower-case hex.
 */
public final class AccountId implements Comparable<AccountId> {

    private static final Pattern RAW = Pattern.compile("^(-?\\d{1,10}):([0-9a-fA-F]{64})$");
    private static final int HASH_LENGTH = 32;
    private static final int FRIENDLY_LENGTH = 48;
    private static final int FRIENDLY_BYTES = 36;
    /** Flag bits of the user-friendly tag byte. */
    private static final int TAG_BOUNCEABLE = 0x11;
    private static final int TAG_NON_BOUNCEABLE = 0x51;
    private static final int TAG_TESTNET = 0x80;

    private final int workchain;
    private final byte[] hash;

    public AccountId(int workchain, byte[] hash) {
        if (hash == null || hash.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Account hash must be 32 bytes");
        }
        this.workchain = workchain;
        this.hash = hash.clone();
    }

    public static AccountId parse(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        String trimmed = address.trim();
        Matcher raw = RAW.matcher(trimmed);
        if (raw.matches()) {
            return new AccountId(Integer.parseInt(raw.group(1)), HexFormat.of().parseHex(raw.group(2)));
        }
        if (trimmed.length() == FRIENDLY_LENGTH) {
            return parseUserFriendly(trimmed);
        }
        throw new IllegalArgumentException("Invalid account address: " + address);
    }

    public static Optional<AccountId> tryParse(String address) {
        try {
            return Optional.of(parse(address));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static AccountId parseUserFriendly(String address) {
        byte[] data;
        try {
            data = Base64.getDecoder().decode(address.replace('-', '+').replace('_', '/'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid account address: " + address, e);
        }
        if (data.length != FRIENDLY_BYTES) {
            throw new IllegalArgumentException("Invalid account address: " + address);
        }
        int tag = (data[0] & 0xff) & ~TAG_TESTNET;
        if (tag != TAG_BOUNCEABLE && tag != TAG_NON_BOUNCEABLE) {
            throw new IllegalArgumentException("Unknown address tag in " + address);
        }
        int expectedCrc = ((data[34] & 0xff) << 8) | (data[35] & 0xff);
        if (crc16(data, 34) != expectedCrc) {
            throw new IllegalArgumentException("Address checksum mismatch: " + address);
        }
        return new AccountId(data[1], Arrays.copyOfRange(data, 2, 34));
    }

    /** CRC16/XMODEM (poly 0x1021, init 0). */
    static int crc16(byte[] data, int length) {
        int crc = 0;
        for (int i = 0; i < length; i++) {
            crc ^= (data[i] & 0xff) << 8;
            for (int bit = 0; bit < 8; bit++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
            }
            crc &= 0xffff;
        }
        return crc;
    }

    public int getWorkchain() {
        return workchain;
    }

    public byte[] getHash() {
        return hash.clone();
    }

    public String toRaw() {
        return workchain + ":" + HexFormat.of().formatHex(hash);
    }

    @Override
    public int compareTo(AccountId other) {
        int byWorkchain = Integer.compare(workchain, other.workchain);
        return byWorkchain != 0 ? byWorkchain : Arrays.compareUnsigned(hash, other.hash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccountId other)) return false;
        return workchain == other.workchain && Arrays.equals(hash, other.hash);
    }

    @Override
    public int hashCode() {
        return 31 * workchain + Arrays.hashCode(hash);
    }

    @Override
    public String toString() {
        return toRaw();
    }
}
