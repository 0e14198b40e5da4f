package com.remit.matching.scoring;

import com.remit.matching.match.MatchResult;

import java.math.BigDecimal;

/**
 * Thresholds that route a match to automatic approval or to a human reviewer.
 */
public class ReviewPolicy {

    public enum Decision {
        AUTO_APPROVE,
        REVIEW,
        MANUAL_REVIEW
    }

    public static final BigDecimal DEFAULT_AUTO_APPROVE_THRESHOLD = new BigDecimal("0.85");
    public static final BigDecimal DEFAULT_MANUAL_REVIEW_THRESHOLD = new BigDecimal("0.50");

    private final BigDecimal autoApproveThreshold;
    private final BigDecimal manualReviewThreshold;

    public ReviewPolicy() {
        this(DEFAULT_AUTO_APPROVE_THRESHOLD, DEFAULT_MANUAL_REVIEW_THRESHOLD);
    }

    public ReviewPolicy(BigDecimal autoApproveThreshold, BigDecimal manualReviewThreshold) {
        if (manualReviewThreshold.compareTo(autoApproveThreshold) > 0) {
            throw new IllegalArgumentException("Manual review threshold " + manualReviewThreshold +
                " exceeds auto-approve threshold " + autoApproveThreshold);
        }
        this.autoApproveThreshold = autoApproveThreshold;
        this.manualReviewThreshold = manualReviewThreshold;
    }

    public boolean shouldAutoApprove(BigDecimal confidence) {
        return confidence != null && confidence.compareTo(autoApproveThreshold) >= 0;
    }

    public boolean requiresManualReview(BigDecimal confidence) {
        return confidence == null || confidence.compareTo(manualReviewThreshold) < 0;
    }

    /**
     * Route one result. Unmatched lines always go to manual review.
     */
    public Decision decide(MatchResult result) {
        BigDecimal confidence = result.getConfidence().orElse(null);
        if (shouldAutoApprove(confidence)) {
            return Decision.AUTO_APPROVE;
        }
        return requiresManualReview(confidence) ? Decision.MANUAL_REVIEW : Decision.REVIEW;
    }

    public BigDecimal getAutoApproveThreshold() {
        return autoApproveThreshold;
    }

    public BigDecimal getManualReviewThreshold() {
        return manualReviewThreshold;
    }
}
