package com.remit.matching.command;

import com.remit.matching.match.MatchResult;
import com.remit.matching.match.MatchRun;
import com.remit.matching.match.MatchingEngine;
import com.remit.matching.match.PaymentLine;
import com.remit.matching.normalize.NormalizationPass;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs a fixed reference batch through the engine and checks every line's outcome.
 * Exits with 0 when all expectations hold.
 */
@Command(
    name = "verify",
    description = "Run the built-in reference batch and check every match",
    mixinStandardHelpOptions = true
)
public class VerifyCommand implements Callable<Integer> {

    static final List<String> REFERENCE_INVOICES = List.of(
        "Invoice-Sarah-39859",
        "INV 39832",
        "Inv--39791",
        "ABC-123-DEF",
        "XYZ456QRS",
        "EXACT-MATCH-001"
    );

    static final List<Expectation> REFERENCE_EXPECTATIONS = List.of(
        new Expectation("EXACT-MATCH-001", NormalizationPass.EXACT, "EXACT-MATCH-001"),
        new Expectation("39859", NormalizationPass.NUMERIC, "Invoice-Sarah-39859"),
        new Expectation("INV39832", NormalizationPass.RELAXED, "INV 39832"),
        new Expectation("INV39791", NormalizationPass.RELAXED, "Inv--39791"),
        new Expectation("123", NormalizationPass.NUMERIC, "ABC-123-DEF"),
        new Expectation("456", NormalizationPass.NUMERIC, "XYZ456QRS"),
        new Expectation("NOMATCH99999", null, null)
    );

    record Expectation(String payment, NormalizationPass pass, String invoice) {
    }

    @Option(names = {"-t", "--threads"}, description = "Worker threads", defaultValue = "4")
    private int threads;

    private final PrintStream out;

    public VerifyCommand() {
        this(System.out);
    }

    VerifyCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        List<PaymentLine> payments = new ArrayList<>();
        for (Expectation expectation : REFERENCE_EXPECTATIONS) {
            payments.add(new PaymentLine(expectation.payment(), null));
        }

        out.printf("Verifying %d payments against %d invoices%n%n", payments.size(), REFERENCE_INVOICES.size());

        MatchRun run;
        try (MatchingEngine engine = new MatchingEngine(threads)) {
            run = engine.match(REFERENCE_INVOICES, payments);
        }

        int failures = 0;
        for (int i = 0; i < REFERENCE_EXPECTATIONS.size(); i++) {
            Expectation expected = REFERENCE_EXPECTATIONS.get(i);
            MatchResult actual = run.getResults().get(i);

            NormalizationPass pass = actual.getPass().orElse(null);
            String invoice = actual.getMatchedInvoice().orElse(null);

            if (pass == expected.pass() && Objects.equals(invoice, expected.invoice())) {
                out.printf("  OK    '%s' -> %s%n", expected.payment(), describe(pass, invoice));
            } else {
                failures++;
                out.printf("  FAIL  '%s' expected %s but got %s%n", expected.payment(),
                    describe(expected.pass(), expected.invoice()), describe(pass, invoice));
            }
        }

        out.println();
        if (failures == 0) {
            out.println("All reference matches verified.");
            return 0;
        }
        out.printf("%d of %d reference matches failed.%n", failures, REFERENCE_EXPECTATIONS.size());
        return 1;
    }

    private String describe(NormalizationPass pass, String invoice) {
        if (pass == null) {
            return "no match";
        }
        return "'" + invoice + "' (" + pass.getLabel() + ")";
    }
}
