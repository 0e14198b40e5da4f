package com.remit.matching.match;

import com.remit.matching.normalize.NormalizationPass;

/**
 * A single pass's answer for one payment line: the pass and the invoice it selected.
 */
public record PassMatch(NormalizationPass pass, String invoiceNumber) {
}
