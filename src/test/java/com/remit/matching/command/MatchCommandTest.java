package com.remit.matching.command;

import com.remit.matching.RemitMatchCli;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MatchCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    private Path invoiceFile;
    private Path paymentFile;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));

        invoiceFile = tempDir.resolve("invoices.yaml");
        Files.writeString(invoiceFile, """
            invoices:
              - number: "EXACT-MATCH-001"
                total: 120.50
                status: AUTHORISED
              - number: "INV 39832"
                total: 75.00
                status: AUTHORISED
              - number: "VOIDED-1"
                status: VOIDED
            """);

        paymentFile = tempDir.resolve("payments.yaml");
        Files.writeString(paymentFile, """
            payments:
              - invoiceNumber: "EXACT-MATCH-001"
                paidAmount: 120.50
              - invoiceNumber: "INV39832"
                paidAmount: 75.00
              - invoiceNumber: "VOIDED-1"
                paidAmount: 10
            """);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int execute(String... args) {
        return new CommandLine(new RemitMatchCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
    }

    @Test
    void shouldPrintJsonResults() {
        int exitCode = execute("match", "-i", invoiceFile.toString(), "-p", paymentFile.toString(),
            "--output-format", "json");

        String output = stdout.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output)
            .contains("\"matchedInvoice\": \"EXACT-MATCH-001\"")
            .contains("\"pass\": \"exact\"")
            .contains("\"confidence\": 0.9500")
            .contains("\"decision\": \"auto_approve\"")
            .contains("\"matchedInvoice\": \"INV 39832\"")
            .contains("\"pass\": \"relaxed\"")
            .contains("\"totalLines\": 3")
            .contains("\"matchedCount\": 2")
            .doesNotContain("Remittance Matching");
    }

    @Test
    void shouldPrintCsvResults() {
        int exitCode = execute("match", "-i", invoiceFile.toString(), "-p", paymentFile.toString(),
            "--output-format", "CSV", "--threads", "1");

        String output = stdout.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output)
            .startsWith("line,payment_reference,paid_amount,matched_invoice,pass,confidence,category,decision")
            .contains("1,EXACT-MATCH-001,120.50,EXACT-MATCH-001,exact,0.9500,very_high,auto_approve")
            .contains("3,VOIDED-1,10,,,,,manual_review");
    }

    @Test
    void shouldPrintCompactSummaryWhenQuiet() {
        int exitCode = execute("match", "-i", invoiceFile.toString(), "-p", paymentFile.toString(), "-q");

        String output = stdout.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output).startsWith("Matched 2/3 lines (66.67%): exact=1 relaxed=1 numeric=0");
    }

    @Test
    void shouldPrintFullReportByDefault() {
        int exitCode = execute("-v", "match", "-i", invoiceFile.toString(), "-p", paymentFile.toString());

        String output = stdout.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output)
            .contains("Remittance Matching")
            .contains("Line Results")
            .contains("Summary");
    }

    @Test
    void shouldApplyConfigFile() throws IOException {
        Path configFile = tempDir.resolve("config.yaml");
        Files.writeString(configFile, """
            invoices:
              statuses: [AUTHORISED, VOIDED]
            output:
              format: json
            """);

        int exitCode = execute("match", "-i", invoiceFile.toString(), "-p", paymentFile.toString(),
            "-f", configFile.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("\"matchedCount\": 3");
    }

    @Test
    void shouldReturnErrorForMissingInvoiceFile() {
        int exitCode = execute("match", "-i", tempDir.resolve("missing.yaml").toString(),
            "-p", paymentFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Error: ").contains("missing.yaml");
    }
}
