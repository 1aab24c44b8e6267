package com.traceradar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiteServerTest {

    private static final String KEY = "n4VDnSCUuSpjnCyUk9e3QOOd6o0ItSWYbTnW3Wnn8wk=";

    @Test
    @DisplayName("parses ip:port:key entries and skips blanks")
    void parsesList() {
        List<LiteServer> servers = LiteServer.parseList(Arrays.asList("5.9.10.47:19949:" + KEY, " ", null));

        assertThat(servers).containsExactly(new LiteServer("5.9.10.47", 19949, KEY));
        assertThat(servers.get(0).toString()).isEqualTo("5.9.10.47:19949");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "5.9.10.47:19949",
            "5.9.10.47:port:" + KEY,
            "5.9.10.47:0:" + KEY,
            "5.9.10.47:19949:not*base64",
            "5.9.10.47:19949:AAAA"
    })
    @DisplayName("malformed entries fail with IllegalArgumentException")
    void rejectsMalformed(String entry) {
        assertThatThrownBy(() -> LiteServer.parse(entry)).isInstanceOf(IllegalArgumentException.class);
    }
}
