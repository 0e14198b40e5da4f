package com.remit.matching.source;

import com.remit.matching.match.MatchingException;
import com.remit.matching.match.PaymentLine;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlInvoiceSourceTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    class InvoiceLedgerTests {

        @Test
        void shouldReadInvoicesInLedgerOrder() throws IOException {
            // Given
            Path file = write("invoices.yaml", """
                invoices:
                  - number: "INV 39832"
                    total: 120.50
                    status: AUTHORISED
                  - number: "Inv--39791"
                    total: 75
                  - "EXACT-MATCH-001"
                """);

            // When
            List<InvoiceRecord> invoices = new YamlInvoiceSource(file.toString(), Set.of("AUTHORISED"))
                .fetchInvoices(null);

            // Then
            assertThat(invoices).extracting(InvoiceRecord::getInvoiceNumber)
                .containsExactly("INV 39832", "Inv--39791", "EXACT-MATCH-001");
            assertThat(invoices.get(0).getTotal()).isEqualByComparingTo("120.50");
            assertThat(invoices.get(1).getTotal()).isEqualByComparingTo("75");
            assertThat(invoices.get(2).getTotal()).isNull();
        }

        @Test
        void shouldDropBlankNumbersAndOtherStatuses() throws IOException {
            Path file = write("invoices.yaml", """
                invoices:
                  - number: ""
                    status: AUTHORISED
                  - number: "PAID-1"
                    status: PAID
                  - number: "DRAFT-1"
                    status: draft
                  - number: "AUTH-1"
                    status: authorised
                """);

            List<InvoiceRecord> invoices = new YamlInvoiceSource(file.toString(), Set.of("authorised", "DRAFT"))
                .fetchInvoices(null);

            assertThat(invoices).extracting(InvoiceRecord::getInvoiceNumber)
                .containsExactly("DRAFT-1", "AUTH-1");
        }

        @Test
        void shouldRestrictToOrganization() throws IOException {
            Path file = write("invoices.yaml", """
                invoices:
                  - number: "A-1"
                    organization: acme
                  - number: "B-1"
                    organization: globex
                  - number: "SHARED-1"
                """);

            List<InvoiceRecord> invoices = new YamlInvoiceSource(file.toString(), Set.of("AUTHORISED"))
                .fetchInvoices("acme");

            assertThat(invoices).extracting(InvoiceRecord::getInvoiceNumber)
                .containsExactly("A-1", "SHARED-1");
        }

        @Test
        void shouldKeepUnquotedNumbersAsWritten() throws IOException {
            // Given
            Path file = write("invoices.yaml", """
                invoices:
                  - number: 0123
                    total: 10.10
                  - number: 1_000
                  - number: 2024-01-31
                  - number: NO
                  - 00777
                """);

            // When
            List<InvoiceRecord> invoices = new YamlInvoiceSource(file.toString(), Set.of("AUTHORISED"))
                .fetchInvoices(null);

            // Then
            assertThat(invoices).extracting(InvoiceRecord::getInvoiceNumber)
                .containsExactly("0123", "1_000", "2024-01-31", "NO", "00777");
            assertThat(invoices.get(0).getTotal()).isEqualTo(new BigDecimal("10.10"));
        }

        @Test
        void shouldReturnEmptyListForEmptyDocument() throws IOException {
            Path file = write("invoices.yaml", "");

            assertThat(new YamlInvoiceSource(file.toString(), Set.of()).fetchInvoices(null)).isEmpty();
        }

        @Test
        void shouldFailForMissingFile() {
            YamlInvoiceSource source = new YamlInvoiceSource(tempDir.resolve("missing.yaml").toString(), Set.of());

            assertThatThrownBy(() -> source.fetchInvoices(null))
                .isInstanceOf(MatchingException.class)
                .hasMessageContaining("missing.yaml");
        }
    }

    @Nested
    class PaymentAdviceTests {

        @Test
        void shouldReadPaymentLines() throws IOException {
            Path file = write("payments.yaml", """
                payments:
                  - invoiceNumber: "INV39832"
                    paidAmount: 120.50
                  - invoiceNumber: 39859
                    paidAmount: "99.99"
                  - "NOMATCH99999"
                """);

            List<PaymentLine> lines = new PaymentAdviceReader().read(file.toString());

            assertThat(lines).hasSize(3);
            assertThat(lines.get(0).getRawInvoiceText()).isEqualTo("INV39832");
            assertThat(lines.get(0).getPaidAmount()).isEqualByComparingTo("120.50");
            assertThat(lines.get(1).getRawInvoiceText()).isEqualTo("39859");
            assertThat(lines.get(1).getPaidAmount()).isEqualByComparingTo(new BigDecimal("99.99"));
            assertThat(lines.get(2).getPaidAmount()).isNull();
        }

        @Test
        void shouldKeepUnquotedReferencesAsWritten() throws IOException {
            Path file = write("payments.yaml", """
                payments:
                  - invoiceNumber: 0123
                    paidAmount: 99.90
                  - 00777
                """);

            List<PaymentLine> lines = new PaymentAdviceReader().read(file.toString());

            assertThat(lines).extracting(PaymentLine::getRawInvoiceText).containsExactly("0123", "00777");
            assertThat(lines.get(0).getPaidAmount()).isEqualTo(new BigDecimal("99.90"));
        }

        @Test
        void shouldRejectUnreadableAmount() throws IOException {
            Path file = write("payments.yaml", """
                payments:
                  - invoiceNumber: "INV-1"
                    paidAmount: "twelve"
                """);

            assertThatThrownBy(() -> new PaymentAdviceReader().read(file.toString()))
                .isInstanceOf(MatchingException.class)
                .hasMessageContaining("twelve");
        }

        @Test
        void shouldRejectNonListPayments() throws IOException {
            Path file = write("payments.yaml", "payments: INV-1\n");

            assertThatThrownBy(() -> new PaymentAdviceReader().read(file.toString()))
                .isInstanceOf(MatchingException.class)
                .hasMessageContaining("must be a list");
        }
    }
}
