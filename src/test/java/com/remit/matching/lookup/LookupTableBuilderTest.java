package com.remit.matching.lookup;

import com.remit.matching.normalize.NormalizationPass;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LookupTableBuilderTest {

    @Test
    void shouldGroupInvoicesSharingAKeyInLedgerOrder() {
        // Given
        List<String> invoices = List.of("INV 001", "X-9", "inv-001");

        // When
        LookupTable table = LookupTableBuilder.build(NormalizationPass.RELAXED, invoices);

        // Then
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.candidates("INV001")).containsExactly("INV 001", "inv-001");
        assertThat(table.first("INV001")).contains("INV 001");
        assertThat(table.getCollisionCount()).isEqualTo(1);
        assertThat(table.getInvoiceCount()).isEqualTo(3);
    }

    @Test
    void shouldSkipNumericKeysBelowDigitFloor() {
        // Given
        LookupTableBuilder builder = new LookupTableBuilder(NormalizationPass.NUMERIC);

        // When
        builder.addAll(List.of("A-1", "B-22", "C-333"));
        LookupTable table = builder.build();

        // Then
        assertThat(table.asMap()).containsOnlyKeys("333");
        assertThat(builder.getSkipped()).isEqualTo(2);
    }

    @Test
    void shouldSkipBlankInvoiceNumbers() {
        LookupTable table = LookupTableBuilder.build(NormalizationPass.EXACT, List.of("", "   ", "A"));

        assertThat(table.asMap()).containsOnlyKeys("A");
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        LookupTable table = LookupTableBuilder.build(NormalizationPass.EXACT, List.of("A"));

        assertThat(table.first("B")).isEmpty();
        assertThat(table.candidates("B")).isEmpty();
    }

    @Test
    void shouldRejectAdditionsAfterBuild() {
        LookupTableBuilder builder = new LookupTableBuilder(NormalizationPass.EXACT);
        builder.add("A");
        builder.build();

        assertThatThrownBy(() -> builder.add("B"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldBeImmutableOnceBuilt() {
        LookupTable table = LookupTableBuilder.build(NormalizationPass.EXACT, List.of("A"));

        assertThatThrownBy(() -> table.asMap().put("B", List.of("B")))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> table.candidates("A").add("C"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRequireATablePerPass() {
        LookupTables empty = LookupTables.empty();

        assertThat(empty.totalKeys()).isZero();
        assertThatThrownBy(() -> new LookupTables(java.util.Map.of(
                NormalizationPass.EXACT, LookupTable.empty(NormalizationPass.EXACT))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("relaxed");
    }
}
