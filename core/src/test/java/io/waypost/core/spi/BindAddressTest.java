package io.waypost.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("BindAddress")
class BindAddressTest {

    @Test
    @DisplayName("parses host:port")
    void parsesHostPort() {
        BindAddress address = BindAddress.parse("127.0.0.1:8080");

        assertThat(address.host()).isEqualTo("127.0.0.1");
        assertThat(address.port()).isEqualTo(8080);
        assertThat(address).hasToString("127.0.0.1:8080");
    }

    @Test
    @DisplayName("bracketed IPv6 host")
    void ipv6() {
        BindAddress address = BindAddress.parse("[::1]:0");

        assertThat(address.host()).isEqualTo("::1");
        assertThat(address.port()).isZero();
        assertThat(address).hasToString("[::1]:0");
    }

    @ParameterizedTest
    @ValueSource(strings = {"localhost", ":8080", "localhost:", "localhost:http", "localhost:70000"})
    @DisplayName("malformed addresses are rejected")
    void rejectsMalformed(String raw) {
        assertThatThrownBy(() -> BindAddress.parse(raw)).isInstanceOf(IllegalArgumentException.class);
    }
}
