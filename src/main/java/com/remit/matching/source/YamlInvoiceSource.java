package com.remit.matching.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Invoice ledger exported to a YAML file:
 * <pre>
 * invoices:
 *   - number: "INV 39832"
 *     total: 120.50
 *     status: AUTHORISED
 *     organization: acme
 *   - "EXACT-MATCH-001"
 * </pre>
 * Records with a blank number, a status outside the accepted set or another organization are
 * dropped. Records without a status or organization are kept.
 */
public class YamlInvoiceSource implements InvoiceSource {

    private static final Logger log = LoggerFactory.getLogger(YamlInvoiceSource.class);

    private final String filePath;
    private final Set<String> acceptedStatuses;

    public YamlInvoiceSource(String filePath, Set<String> acceptedStatuses) {
        this.filePath = filePath;
        this.acceptedStatuses = acceptedStatuses.stream()
            .map(s -> s.toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public List<InvoiceRecord> fetchInvoices(String organizationId) {
        List<InvoiceRecord> invoices = new ArrayList<>();
        int dropped = 0;

        for (Object entry : YamlDocuments.loadList(filePath, "invoices")) {
            InvoiceRecord record = toRecord(entry);
            if (accepts(record, organizationId)) {
                invoices.add(record);
            } else {
                dropped++;
            }
        }

        log.debug("Loaded {} invoices from {} ({} filtered out)", invoices.size(), filePath, dropped);
        return invoices;
    }

    private InvoiceRecord toRecord(Object entry) {
        if (entry instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) entry;
            return new InvoiceRecord(
                YamlDocuments.toText(map.get("number")),
                YamlDocuments.toDecimal(map.get("total")),
                YamlDocuments.toText(map.get("status")),
                YamlDocuments.toText(map.get("organization")));
        }
        return new InvoiceRecord(YamlDocuments.toText(entry), null);
    }

    private boolean accepts(InvoiceRecord record, String organizationId) {
        if (record.getInvoiceNumber() == null || record.getInvoiceNumber().isBlank()) {
            return false;
        }
        if (record.getStatus() != null && !acceptedStatuses.contains(record.getStatus().toUpperCase(Locale.ROOT))) {
            return false;
        }
        return organizationId == null
            || record.getOrganizationId() == null
            || record.getOrganizationId().equals(organizationId);
    }
}
