package com.contractradar.reputation;

import com.contractradar.reputation.config.ReputationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KnownAddressRegistriesTest {

    @Test
    @DisplayName("built-in programs resolve and configured entries extend the registry")
    void knownPrograms() {
        ReputationProperties properties = new ReputationProperties();
        properties.setKnownPrograms(Map.of(" Custom111 ", "My DEX"));
        KnownProgramRegistry registry = new DefaultKnownProgramRegistry(properties);

        assertThat(registry.getProgramName("JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4"))
                .contains("Jupiter Aggregator v6");
        assertThat(registry.getProgramName("Custom111")).contains("My DEX");
        assertThat(registry.getProgramName("Nope111")).isEmpty();
        assertThat(registry.getProgramName(null)).isEmpty();
    }

    @Test
    @DisplayName("drainer blocklist matches exactly and drops blanks")
    void drainerBlocklist() {
        ReputationProperties properties = new ReputationProperties();
        properties.setDrainerBlocklist(Arrays.asList("Drain111", " ", null, "Drain222 "));
        DrainerBlocklist blocklist = new DrainerBlocklist(properties);

        assertThat(blocklist.size()).isEqualTo(2);
        assertThat(blocklist.isKnownDrainer("Drain222")).isTrue();
        assertThat(blocklist.isKnownDrainer("drain111")).isFalse();
        assertThat(blocklist.isKnownDrainer(null)).isFalse();
    }
}
