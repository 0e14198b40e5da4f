package com.remit.matching.source;

import com.remit.matching.match.PaymentLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads extracted payment-advice lines from YAML:
 * <pre>
 * payments:
 *   - invoiceNumber: "INV39832"
 *     paidAmount: 120.50
 *   - "39859"
 * </pre>
 */
public class PaymentAdviceReader {

    public List<PaymentLine> read(String filePath) {
        List<PaymentLine> lines = new ArrayList<>();
        for (Object entry : YamlDocuments.loadList(filePath, "payments")) {
            if (entry instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) entry;
                lines.add(new PaymentLine(
                    YamlDocuments.toText(map.get("invoiceNumber")),
                    YamlDocuments.toDecimal(map.get("paidAmount"))));
            } else {
                lines.add(new PaymentLine(YamlDocuments.toText(entry), null));
            }
        }
        return lines;
    }
}
