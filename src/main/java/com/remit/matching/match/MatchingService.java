package com.remit.matching.match;

import com.remit.matching.scoring.AmountTolerance;
import com.remit.matching.source.InvoiceRecord;
import com.remit.matching.source.InvoiceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches a payment advice against an organization's outstanding invoices.
 * Fetching the snapshot happens before any matching starts; a failed fetch aborts the run.
 */
public class MatchingService {

    private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

    private final InvoiceSource invoiceSource;
    private final MatchingEngine engine;
    private final BigDecimal amountTolerance;

    public MatchingService(InvoiceSource invoiceSource, MatchingEngine engine) {
        this(invoiceSource, engine, AmountTolerance.DEFAULT_TOLERANCE);
    }

    public MatchingService(InvoiceSource invoiceSource, MatchingEngine engine, BigDecimal amountTolerance) {
        this.invoiceSource = invoiceSource;
        this.engine = engine;
        this.amountTolerance = amountTolerance;
    }

    /**
     * @param organizationId organization whose ledger is matched
     * @param payments extracted payment lines in document order
     * @throws MatchingException if the invoice snapshot cannot be fetched
     */
    public MatchRun match(String organizationId, List<PaymentLine> payments) {
        List<InvoiceRecord> invoices = fetchInvoices(organizationId);

        List<String> invoiceNumbers = new ArrayList<>(invoices.size());
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (InvoiceRecord invoice : invoices) {
            invoiceNumbers.add(invoice.getInvoiceNumber());
            // the first record wins, consistent with lookup-table tie-breaking
            if (!totals.containsKey(invoice.getInvoiceNumber())) {
                totals.put(invoice.getInvoiceNumber(), invoice.getTotal());
            }
        }

        log.info("Matching {} payment lines against {} invoices for organization {}",
            payments.size(), invoiceNumbers.size(), organizationId);

        return engine.match(invoiceNumbers, payments, AmountTolerance.fromTotals(totals, amountTolerance));
    }

    private List<InvoiceRecord> fetchInvoices(String organizationId) {
        try {
            return invoiceSource.fetchInvoices(organizationId);
        } catch (MatchingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to fetch invoices for organization {}: {}", organizationId, e.getMessage());
            throw new MatchingException("Failed to fetch invoices: " + e.getMessage(), e);
        }
    }
}
