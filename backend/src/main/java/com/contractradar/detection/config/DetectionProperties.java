package com.contractradar.detection.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Detector thresholds. Percentages are 0..100, money in USD.
 */
@ConfigurationProperties(prefix = "contractradar.detection")
@Getter
@Setter
public class DetectionProperties {

    private Token token = new Token();
    private Dex dex = new Dex();

    @Getter
    @Setter
    public static class Token {
        /** 24h price drop (percent) that marks a failed project. */
        private double failedProjectDropPercent = 95;
        private double lowVolumeUsd = 100;
        private double creatorHoldingsCriticalPercent = 30;
        private double creatorHoldingsHighPercent = 10;
        private double top10ConcentrationPercent = 80;
        private double criticalLiquidityUsd = 1_000;
        private double lowLiquidityUsd = 10_000;
        private double newTokenHours = 24;
        private double sellSlippageCriticalPercent = 30;
        private double sellSlippageHighPercent = 10;
        private double sellSlippageModeratePercent = 5;
        private double extremeConcentrationPercent = 50;
        private double highConcentrationPercent = 25;
        private double failureRatePercent = 30;
        /** Recent signatures sampled by the transactions step. */
        private int signatureSample = 100;
        /** Largest accounts reported in tokenData.topHolders. */
        private int topHolders = 20;
    }

    @Getter
    @Setter
    public static class Dex {
        private double errorRatePercent = 5;
        private int signatureSample = 1000;
        /** 24h volume above this multiple of liquidity is flagged. */
        private double volumeToLiquidityRatio = 2;
        private double pricePumpPercent = 50;
    }
}
