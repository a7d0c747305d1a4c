package com.phylotree.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmissionLedgerTest {

    @Test
    void recordsEachNameOnce() {
        EmissionLedger ledger = new EmissionLedger();

        assertThat(ledger.record("weight")).isTrue();
        assertThat(ledger.record("weight")).isFalse();

        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.contains("weight")).isTrue();
    }

    @Test
    void keepsRecordingOrder() {
        EmissionLedger ledger = new EmissionLedger();
        ledger.record("phylogeny.name");
        ledger.record("weight");
        ledger.record("node name");

        assertThat(ledger.names()).containsExactly("phylogeny.name", "weight", "node name");
    }

    @Test
    void startsWithIgnoredColumns() {
        EmissionLedger ledger = EmissionLedger.seededWith(List.of("internal id", "internal id", "scratch"));

        assertThat(ledger.names()).containsExactly("internal id", "scratch");
    }
}
