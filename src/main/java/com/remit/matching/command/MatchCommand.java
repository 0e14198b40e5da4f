package com.remit.matching.command;

import com.remit.matching.RemitMatchCli;
import com.remit.matching.config.MatchConfig;
import com.remit.matching.match.MatchRun;
import com.remit.matching.match.MatchingEngine;
import com.remit.matching.match.MatchingService;
import com.remit.matching.match.PaymentLine;
import com.remit.matching.report.ConsoleReporter;
import com.remit.matching.scoring.ReviewPolicy;
import com.remit.matching.source.PaymentAdviceReader;
import com.remit.matching.source.YamlInvoiceSource;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "match",
    description = "Match a payment advice against an invoice ledger",
    mixinStandardHelpOptions = true
)
public class MatchCommand implements Callable<Integer> {

    @ParentCommand
    private RemitMatchCli parent;

    @Option(names = {"-i", "--invoices"}, description = "Invoice ledger YAML file", required = true)
    private String invoiceFile;

    @Option(names = {"-p", "--payments"}, description = "Payment advice YAML file", required = true)
    private String paymentFile;

    @Option(names = {"-o", "--organization"}, description = "Organization whose invoices are matched")
    private String organizationId;

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    private String configFile;

    @Option(names = {"-t", "--threads"}, description = "Worker threads")
    private Integer threads;

    @Option(names = {"--amount-tolerance"}, description = "Absolute tolerance for amount agreement")
    private BigDecimal amountTolerance;

    @Option(names = {"--output-format"}, description = "Output format: console, csv, json")
    private MatchConfig.OutputFormat outputFormat;

    @Option(names = {"-q", "--quiet"}, description = "Print only the summary line", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            MatchConfig config = buildConfig();
            return executeMatch(config);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private MatchConfig buildConfig() throws IOException {
        MatchConfig config = configFile != null ? MatchConfig.fromYaml(configFile) : new MatchConfig();

        // CLI options override config file
        if (threads != null) {
            config.setThreads(threads);
        }
        if (amountTolerance != null) {
            config.setAmountTolerance(amountTolerance);
        }
        if (outputFormat != null) {
            config.setOutputFormat(outputFormat);
        }
        if (quiet) {
            config.setQuiet(true);
        }

        return config;
    }

    private int executeMatch(MatchConfig config) {
        boolean verbose = parent != null && parent.isVerbose();
        boolean console = config.getOutputFormat() == MatchConfig.OutputFormat.CONSOLE;
        ConsoleReporter reporter = new ConsoleReporter(System.out, config.isQuiet() || !console, verbose);
        ReviewPolicy policy = config.toReviewPolicy();

        YamlInvoiceSource invoiceSource = new YamlInvoiceSource(invoiceFile, new HashSet<>(config.getInvoiceStatuses()));
        List<PaymentLine> payments = new PaymentAdviceReader().read(paymentFile);

        if (console && !config.isQuiet()) {
            reporter.printMatchHeader(config, invoiceFile, paymentFile, payments.size());
        }

        try (MatchingEngine engine = new MatchingEngine(config.getThreads())) {
            MatchingService service = new MatchingService(invoiceSource, engine, config.getAmountTolerance());
            MatchRun run = service.match(organizationId, payments);

            switch (config.getOutputFormat()) {
                case CSV -> reporter.printMatchResultsCsv(run.getResults(), policy);
                case JSON -> reporter.printMatchResultsJson(run, policy);
                default -> reporter.printMatchResults(run, policy);
            }
        }
        return 0;
    }
}
