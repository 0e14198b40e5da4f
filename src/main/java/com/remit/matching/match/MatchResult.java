package com.remit.matching.match;

import com.remit.matching.normalize.NormalizationPass;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching one payment line.
 * The pass and confidence are present if and only if an invoice was matched.
 */
public final class MatchResult {

    private final int lineNumber;
    private final String paymentRawText;
    private final BigDecimal paidAmount;
    private final String matchedInvoice;
    private final NormalizationPass pass;
    private final BigDecimal confidence;

    private MatchResult(int lineNumber, PaymentLine line, String matchedInvoice,
                        NormalizationPass pass, BigDecimal confidence) {
        this.lineNumber = lineNumber;
        this.paymentRawText = line.getRawInvoiceText();
        this.paidAmount = line.getPaidAmount();
        this.matchedInvoice = matchedInvoice;
        this.pass = pass;
        this.confidence = confidence;
    }

    public static MatchResult unmatched(int lineNumber, PaymentLine line) {
        return new MatchResult(lineNumber, line, null, null, null);
    }

    public static MatchResult matched(int lineNumber, PaymentLine line, PassMatch match, BigDecimal confidence) {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(confidence, "confidence");
        return new MatchResult(lineNumber, line, match.invoiceNumber(), match.pass(), confidence);
    }

    /** 1-based position of the line in the payment advice. */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getPaymentRawText() {
        return paymentRawText;
    }

    public BigDecimal getPaidAmount() {
        return paidAmount;
    }

    public boolean isMatched() {
        return matchedInvoice != null;
    }

    public Optional<String> getMatchedInvoice() {
        return Optional.ofNullable(matchedInvoice);
    }

    public Optional<NormalizationPass> getPass() {
        return Optional.ofNullable(pass);
    }

    public Optional<BigDecimal> getConfidence() {
        return Optional.ofNullable(confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchResult)) return false;
        MatchResult that = (MatchResult) o;
        return lineNumber == that.lineNumber
                && paymentRawText.equals(that.paymentRawText)
                && Objects.equals(paidAmount, that.paidAmount)
                && Objects.equals(matchedInvoice, that.matchedInvoice)
                && pass == that.pass
                && Objects.equals(confidence, that.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, paymentRawText, paidAmount, matchedInvoice, pass, confidence);
    }

    @Override
    public String toString() {
        return "MatchResult{" +
                "line=" + lineNumber +
                ", paymentRawText='" + paymentRawText + '\'' +
                ", matchedInvoice=" + (matchedInvoice == null ? "none" : "'" + matchedInvoice + "'") +
                ", pass=" + (pass == null ? "none" : pass.getLabel()) +
                ", confidence=" + confidence +
                '}';
    }
}
