package com.contractradar.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ParameterSetTest {

    @Test
    @DisplayName("registries have the fixed sizes 18/13 and 19/12")
    void registrySizes() {
        assertThat(TokenOnChainParam.values()).hasSize(18);
        assertThat(TokenOffChainParam.values()).hasSize(13);
        assertThat(DexOnChainParam.values()).hasSize(19);
        assertThat(DexOffChainParam.values()).hasSize(12);
    }

    @Test
    @DisplayName("new set starts fully unchecked")
    void startsUnchecked() {
        ParameterSet<TokenOnChainParam> set = new ParameterSet<>(TokenOnChainParam.class);
        assertThat(set.count()).isEqualTo(new ParamCount(0, 0, 18));
        assertThat(set.snapshot().values()).allMatch(s -> s.equals(ParameterState.UNCHECKED));
    }

    @Test
    @DisplayName("snapshot keeps registry order and camelCase keys")
    void snapshotOrder() {
        Map<String, ParameterState> snapshot = new ParameterSet<>(TokenOffChainParam.class).snapshot();
        assertThat(List.copyOf(snapshot.keySet()).subList(0, 3))
                .containsExactly("keyLeakIndicators", "daoEngagementAlerts", "economicModelStress");
    }

    @Test
    @DisplayName("trigger marks checked and counts once")
    void triggerCounts() {
        ParameterSet<TokenOnChainParam> set = new ParameterSet<>(TokenOnChainParam.class);
        set.markChecked(TokenOnChainParam.ASSET_FREEZES);
        set.trigger(TokenOnChainParam.MASSIVE_MINTS, "Enabled");
        set.trigger(TokenOnChainParam.MASSIVE_MINTS, "Other");
        assertThat(set.count()).isEqualTo(new ParamCount(2, 1, 18));
        assertThat(set.get(TokenOnChainParam.MASSIVE_MINTS).value()).isEqualTo("Enabled");
    }

    @Test
    @DisplayName("placeholder count only includes checks without an evidence source")
    void placeholderCount() {
        ParameterSet<TokenOnChainParam> set = new ParameterSet<>(TokenOnChainParam.class);
        set.markChecked(TokenOnChainParam.MASSIVE_MINTS);
        set.markChecked(TokenOnChainParam.GOVERNANCE_EXPLOITS);
        set.markChecked(TokenOnChainParam.OVER_BORROWING);
        assertThat(set.placeholderChecked()).isEqualTo(2);
        assertThat(set.owns(TokenOnChainParam.MASSIVE_MINTS)).isTrue();
        assertThat(set.owns(TokenOffChainParam.RUG_PULL_METRICS)).isFalse();
    }
}
