package com.contractradar.ai;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialPoolTest {

    @Test
    void next_rotatesRoundRobin() {
        CredentialPool pool = new CredentialPool("openrouter", List.of("k1", "k2"));

        assertThat(pool.next()).contains("k1");
        assertThat(pool.next()).contains("k2");
        assertThat(pool.next()).contains("k1");
    }

    @Test
    void blankKeys_areDropped() {
        CredentialPool pool = new CredentialPool("openrouter", Arrays.asList(" ", null, " k1 "));

        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.next()).contains("k1");
    }

    @Test
    void emptyPool_yieldsNothing() {
        CredentialPool pool = new CredentialPool("openrouter", null);

        assertThat(pool.isEmpty()).isTrue();
        assertThat(pool.getName()).isEqualTo("openrouter");
        assertThat(pool.next()).isEmpty();
    }
}
