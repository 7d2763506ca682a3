package com.yuubin.relay.core.utils;

import com.yuubin.relay.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressUtilsTest {

    @Test
    void parse_hostAndPort() {
        InetSocketAddress address = AddressUtils.parse(" localhost:8080 ");

        assertThat(address.getHostString()).isEqualTo("localhost");
        assertThat(address.getPort()).isEqualTo(8080);
    }

    @Test
    void parse_bracketedIpv6() {
        InetSocketAddress address = AddressUtils.parse("[::1]:9000");

        assertThat(address.getPort()).isEqualTo(9000);
        assertThat(address.getAddress().isLoopbackAddress()).isTrue();
    }

    @Test
    void parse_rejectsBadInput() {
        assertThatThrownBy(() -> AddressUtils.parse("")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> AddressUtils.parse("host")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> AddressUtils.parse("host:")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> AddressUtils.parse("host:abc")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> AddressUtils.parse("host:70000")).isInstanceOf(ConfigException.class);
    }

    @Test
    void parseUnresolved_skipsNameLookup() {
        InetSocketAddress address = AddressUtils.parseUnresolved("no-such-host.invalid:443");

        assertThat(address.isUnresolved()).isTrue();
        assertThat(address.getHostString()).isEqualTo("no-such-host.invalid");
        assertThat(address.getPort()).isEqualTo(443);
    }

    @Test
    void parseUnresolved_rejectsUnbracketedIpv6() {
        assertThatThrownBy(() -> AddressUtils.parseUnresolved("::1:80")).isInstanceOf(ConfigException.class);
    }

    @Test
    void isBlank() {
        assertThat(AddressUtils.isBlank(null)).isTrue();
        assertThat(AddressUtils.isBlank("  ")).isTrue();
        assertThat(AddressUtils.isBlank("a:1")).isFalse();
    }
}
