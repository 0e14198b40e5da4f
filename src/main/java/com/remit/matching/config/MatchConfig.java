package com.remit.matching.config;

import com.remit.matching.scoring.AmountTolerance;
import com.remit.matching.scoring.ReviewPolicy;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class MatchConfig {

    public enum OutputFormat {
        CONSOLE,
        CSV,
        JSON
    }

    // Matching
    private int threads = 4;
    private BigDecimal amountTolerance = AmountTolerance.DEFAULT_TOLERANCE;

    // Review routing
    private BigDecimal autoApproveThreshold = ReviewPolicy.DEFAULT_AUTO_APPROVE_THRESHOLD;
    private BigDecimal manualReviewThreshold = ReviewPolicy.DEFAULT_MANUAL_REVIEW_THRESHOLD;

    // Invoice ledger
    private List<String> invoiceStatuses = new ArrayList<>(List.of("AUTHORISED"));

    // Output
    private OutputFormat outputFormat = OutputFormat.CONSOLE;
    private boolean quiet = false;

    public MatchConfig() {
    }

    public static MatchConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Map<String, Object> data = yaml.load(input);
            return fromMap(data == null ? Map.of() : data);
        }
    }

    @SuppressWarnings("unchecked")
    static MatchConfig fromMap(Map<String, Object> data) {
        MatchConfig config = new MatchConfig();

        if (data.containsKey("matching")) {
            Map<String, Object> matching = (Map<String, Object>) data.get("matching");
            if (matching.containsKey("threads")) {
                config.threads = ((Number) matching.get("threads")).intValue();
            }
            if (matching.containsKey("amountTolerance")) {
                config.amountTolerance = toDecimal(matching.get("amountTolerance"));
            }
        }

        if (data.containsKey("review")) {
            Map<String, Object> review = (Map<String, Object>) data.get("review");
            if (review.containsKey("autoApproveThreshold")) {
                config.autoApproveThreshold = toDecimal(review.get("autoApproveThreshold"));
            }
            if (review.containsKey("manualReviewThreshold")) {
                config.manualReviewThreshold = toDecimal(review.get("manualReviewThreshold"));
            }
        }

        if (data.containsKey("invoices")) {
            Map<String, Object> invoices = (Map<String, Object>) data.get("invoices");
            if (invoices.containsKey("statuses")) {
                List<String> statuses = new ArrayList<>();
                for (Object status : (List<Object>) invoices.get("statuses")) {
                    statuses.add(status.toString().toUpperCase(Locale.ROOT));
                }
                config.invoiceStatuses = statuses;
            }
        }

        if (data.containsKey("output")) {
            Map<String, Object> output = (Map<String, Object>) data.get("output");
            if (output.containsKey("format")) {
                config.outputFormat = OutputFormat.valueOf(((String) output.get("format")).toUpperCase(Locale.ROOT));
            }
            if (output.containsKey("quiet")) {
                config.quiet = (Boolean) output.get("quiet");
            }
        }

        return config;
    }

    private static BigDecimal toDecimal(Object value) {
        return new BigDecimal(value.toString());
    }

    public ReviewPolicy toReviewPolicy() {
        return new ReviewPolicy(autoApproveThreshold, manualReviewThreshold);
    }

    // Getters and setters
    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public BigDecimal getAmountTolerance() {
        return amountTolerance;
    }

    public void setAmountTolerance(BigDecimal amountTolerance) {
        this.amountTolerance = amountTolerance;
    }

    public BigDecimal getAutoApproveThreshold() {
        return autoApproveThreshold;
    }

    public void setAutoApproveThreshold(BigDecimal autoApproveThreshold) {
        this.autoApproveThreshold = autoApproveThreshold;
    }

    public BigDecimal getManualReviewThreshold() {
        return manualReviewThreshold;
    }

    public void setManualReviewThreshold(BigDecimal manualReviewThreshold) {
        this.manualReviewThreshold = manualReviewThreshold;
    }

    public List<String> getInvoiceStatuses() {
        return invoiceStatuses;
    }

    public void setInvoiceStatuses(List<String> invoiceStatuses) {
        this.invoiceStatuses = invoiceStatuses;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }
}
