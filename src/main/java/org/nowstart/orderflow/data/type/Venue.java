package org.nowstart.orderflow.data.type;

import lombok.Getter;

@Getter
public enum Venue {
    // primary venue: tighter spread, lower fee, deeper liquidity
    RAYDIUM("Raydium", 95.0, 105.0, 0.0025, 0.003, 1_000_000.0, 5_000_000.0),
    METEORA("Meteora", 97.0, 108.0, 0.003, 0.005, 500_000.0, 3_000_000.0);

    private final String displayName;
    private final double minRate;
    private final double maxRate;
    private final double minFeeRate;
    private final double maxFeeRate;
    private final double minLiquidity;
    private final double maxLiquidity;

    Venue(
            String displayName,
            double minRate,
            double maxRate,
            double minFeeRate,
            double maxFeeRate,
            double minLiquidity,
            double maxLiquidity
    ) {
        this.displayName = displayName;
        this.minRate = minRate;
        this.maxRate = maxRate;
        this.minFeeRate = minFeeRate;
        this.maxFeeRate = maxFeeRate;
        this.minLiquidity = minLiquidity;
        this.maxLiquidity = maxLiquidity;
    }

    public static Venue primary() {
        return RAYDIUM;
    }
}
