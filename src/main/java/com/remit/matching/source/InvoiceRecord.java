package com.remit.matching.source;

import java.math.BigDecimal;

/**
 * An outstanding invoice as known to the ledger.
 */
public final class InvoiceRecord {

    private final String invoiceNumber;
    private final BigDecimal total;
    private final String status;
    private final String organizationId;

    public InvoiceRecord(String invoiceNumber, BigDecimal total, String status, String organizationId) {
        this.invoiceNumber = invoiceNumber;
        this.total = total;
        this.status = status;
        this.organizationId = organizationId;
    }

    public InvoiceRecord(String invoiceNumber, BigDecimal total) {
        this(invoiceNumber, total, null, null);
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    /** May be null when the ledger has no total on record. */
    public BigDecimal getTotal() {
        return total;
    }

    public String getStatus() {
        return status;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    @Override
    public String toString() {
        return "InvoiceRecord{" +
                "invoiceNumber='" + invoiceNumber + '\'' +
                ", total=" + total +
                ", status=" + status +
                ", organizationId=" + organizationId +
                '}';
    }
}
