package org.nowstart.orderflow.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.orderflow.data.type.Venue;

public record RoutingDecision(
        Venue selectedVenue,
        List<Quote> quotes,
        String selectionReason,
        Instant decidedAt
) {

    public Quote selectedQuote() {
        return quotes.stream()
                .filter(quote -> quote.venue() == selectedVenue)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No quote recorded for selected venue=" + selectedVenue));
    }
}
