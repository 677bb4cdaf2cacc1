package org.nowstart.orderflow.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.orderflow.data.dto.Quote;
import org.nowstart.orderflow.data.dto.QuoteSelection;
import org.nowstart.orderflow.data.dto.RoutingDecision;
import org.nowstart.orderflow.data.type.Venue;
import org.nowstart.orderflow.service.venue.QuoteEngine;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingSelectorService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final QuoteEngine quoteEngine;

    public CompletableFuture<QuoteSelection> selectBest(String tokenIn, String tokenOut, BigDecimal amount) {
        List<CompletableFuture<Quote>> pending = Arrays.stream(Venue.values())
                .map(venue -> quoteEngine.quote(venue, tokenIn, tokenOut, amount))
                .toList();

        return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> select(pending.stream().map(CompletableFuture::join).toList()));
    }

    public QuoteSelection select(List<Quote> quotes) {
        if (quotes == null || quotes.isEmpty()) {
            throw new IllegalArgumentException("At least one quote is required");
        }

        Quote best = quotes.stream()
                .max(Comparator.comparing(Quote::netRate))
                .orElseThrow();
        List<Quote> rivals = quotes.stream().filter(quote -> quote != best).toList();
        if (rivals.isEmpty()) {
            return logged(new QuoteSelection(best, quotes, best.venue().getDisplayName() + " is the only venue quoted"));
        }

        Quote runnerUp = rivals.stream().max(Comparator.comparing(Quote::netRate)).orElseThrow();
        String rationale;
        if (best.netRate().compareTo(runnerUp.netRate()) > 0) {
            rationale = String.format(
                    "%s offers better net price (%s%% better than %s)",
                    best.venue().getDisplayName(),
                    advantagePercent(best.netRate(), runnerUp.netRate()).toPlainString(),
                    runnerUp.venue().getDisplayName()
            );
            return logged(new QuoteSelection(best, quotes, rationale));
        }

        List<Quote> tied = quotes.stream()
                .filter(quote -> quote.netRate().compareTo(best.netRate()) == 0)
                .toList();
        Quote deepest = deepestIfDistinct(tied);
        if (deepest != null) {
            rationale = "Prices equal, " + deepest.venue().getDisplayName() + " selected for higher liquidity";
            return logged(new QuoteSelection(deepest, quotes, rationale));
        }

        Quote primary = tied.stream()
                .filter(quote -> quote.venue() == Venue.primary())
                .findFirst()
                .orElse(tied.get(0));
        rationale = "Prices equal, " + primary.venue().getDisplayName() + " selected as default";
        return logged(new QuoteSelection(primary, quotes, rationale));
    }

    public RoutingDecision toDecision(QuoteSelection selection) {
        return new RoutingDecision(
                selection.best().venue(),
                selection.quotes(),
                selection.rationale(),
                Instant.now()
        );
    }

    private Quote deepestIfDistinct(List<Quote> tied) {
        if (tied.stream().anyMatch(quote -> quote.liquidity() == null)) {
            return null;
        }
        Quote deepest = tied.stream().max(Comparator.comparing(Quote::liquidity)).orElseThrow();
        long sameDepth = tied.stream()
                .filter(quote -> quote.liquidity().compareTo(deepest.liquidity()) == 0)
                .count();
        return sameDepth == 1 ? deepest : null;
    }

    private BigDecimal advantagePercent(BigDecimal best, BigDecimal other) {
        if (other.signum() == 0) {
            return HUNDRED.setScale(2, RoundingMode.HALF_UP);
        }
        return best.subtract(other)
                .divide(other, MathContext.DECIMAL64)
                .multiply(HUNDRED)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private QuoteSelection logged(QuoteSelection selection) {
        log.info("Venue selected. venue={}, netRate={}, reason={}",
                selection.best().venue().getDisplayName(), selection.best().netRate(), selection.rationale());
        return selection;
    }
}
