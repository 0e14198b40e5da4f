package com.remit.matching.source;

import java.util.List;

/**
 * Supplies the invoice snapshot a matching run works against.
 *
 * <p>Implementations return invoices in a stable ledger order, already restricted to the statuses
 * that may receive payments and to records carrying a usable invoice number. Matching does no
 * filtering of its own.
 */
public interface InvoiceSource {

    List<InvoiceRecord> fetchInvoices(String organizationId);
}
