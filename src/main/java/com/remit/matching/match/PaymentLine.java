package com.remit.matching.match;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line item of a payment advice: the invoice reference as printed and the amount paid against it.
 */
public final class PaymentLine {

    private final String rawInvoiceText;
    private final BigDecimal paidAmount;

    public PaymentLine(String rawInvoiceText, BigDecimal paidAmount) {
        this.rawInvoiceText = rawInvoiceText == null ? "" : rawInvoiceText;
        this.paidAmount = paidAmount;
    }

    public static PaymentLine of(String rawInvoiceText, String paidAmount) {
        return new PaymentLine(rawInvoiceText, paidAmount == null ? null : new BigDecimal(paidAmount));
    }

    public String getRawInvoiceText() {
        return rawInvoiceText;
    }

    /** May be null when the extraction could not read an amount. */
    public BigDecimal getPaidAmount() {
        return paidAmount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaymentLine)) return false;
        PaymentLine that = (PaymentLine) o;
        return rawInvoiceText.equals(that.rawInvoiceText) && Objects.equals(paidAmount, that.paidAmount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawInvoiceText, paidAmount);
    }

    @Override
    public String toString() {
        return "PaymentLine{" +
                "rawInvoiceText='" + rawInvoiceText + '\'' +
                ", paidAmount=" + paidAmount +
                '}';
    }
}
