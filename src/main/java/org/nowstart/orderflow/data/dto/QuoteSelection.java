package org.nowstart.orderflow.data.dto;

import java.util.List;

public record QuoteSelection(
        Quote best,
        List<Quote> quotes,
        String rationale
) {
}
