package com.yuubin.relay.config;

import com.yuubin.relay.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayPropertiesTest {

    @Test
    void defaults_areValid() {
        RelayProperties props = new RelayProperties();

        assertThatCode(props::validate).doesNotThrowAnyException();
        assertThat(props.getRequestQueueCapacity()).isEqualTo(1024);
        assertThat(props.getTiming().readTimeout()).isEqualTo(Duration.ofMillis(200));
        assertThat(props.getTiming().probeInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.getTiming().probeTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(props.getAdmin().isEnabled()).isFalse();
    }

    @Test
    void yaml_mapsOntoProperties() {
        String yaml = """
                pluginAddress: 127.0.0.1:7001
                controlAddress: "[::1]:7002"
                dataAddress: localhost:7003
                requestQueueCapacity: 16
                timing:
                  readTimeoutMillis: 50
                  probeIntervalMillis: 1000
                  probeTimeoutMillis: 3000
                admin:
                  enabled: true
                  port: 0
                """;

        RelayProperties props = new Yaml(new Constructor(RelayProperties.class, new LoaderOptions())).load(yaml);

        assertThat(props.getPluginAddress()).isEqualTo("127.0.0.1:7001");
        assertThat(props.getControlAddress()).isEqualTo("[::1]:7002");
        assertThat(props.getRequestQueueCapacity()).isEqualTo(16);
        assertThat(props.getTiming().getProbeTimeoutMillis()).isEqualTo(3000);
        assertThat(props.getTiming().getDialTimeoutMillis()).isEqualTo(5000);
        assertThat(props.getAdmin().isEnabled()).isTrue();
        assertThatCode(props::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsTimeoutNotLongerThanInterval() {
        RelayProperties props = new RelayProperties();
        props.getTiming().setProbeIntervalMillis(1000);
        props.getTiming().setProbeTimeoutMillis(1000);

        assertThatThrownBy(props::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("probeTimeoutMillis");
    }

    @Test
    void validate_rejectsNonPositiveTimings() {
        RelayProperties props = new RelayProperties();
        props.getTiming().setReadTimeoutMillis(0);

        assertThatThrownBy(props::validate).isInstanceOf(ConfigException.class).hasMessageContaining("readTimeout");
    }

    @Test
    void validate_rejectsMalformedAddress() {
        RelayProperties props = new RelayProperties();
        props.setDataAddress("no-port");

        assertThatThrownBy(props::validate).isInstanceOf(ConfigException.class).hasMessageContaining("dataAddress");
    }

    @Test
    void validate_rejectsEmptyQueue() {
        RelayProperties props = new RelayProperties();
        props.setRequestQueueCapacity(0);

        assertThatThrownBy(props::validate).isInstanceOf(ConfigException.class);
    }

    @Test
    void adminConfig_equality() {
        AdminConfig a = new AdminConfig();
        AdminConfig b = new AdminConfig();
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);

        b.setPort(9191);
        assertThat(a).isNotEqualTo(b);
    }
}
