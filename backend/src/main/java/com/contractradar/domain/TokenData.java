package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Token-mode payload of a detection result. Fields stay null when their source was unavailable.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenData(
        String name,
        String symbol,
        String imageUrl,
        Integer decimals,
        Double supply,
        String mintAuthority,
        String freezeAuthority,
        Double price,
        Double marketCap,
        Double liquidity,
        Long holders,
        Double volume24h,
        Double priceChange24h,
        String creatorAddress,
        Double creatorPercentage,
        Boolean lpBurned,
        Double lpBurnedPercent,
        Double top10HolderPercent,
        Long createdAt,
        Double ageInDays,
        List<TopHolder> topHolders,
        Integer safetyScore,
        String safetyRating,
        Double buySlippage,
        Double sellSlippage,
        Boolean honeypot,
        Integer dexPairs,
        List<String> dexNames,
        Integer transactionsSampled,
        Double failureRate,
        String ownerProgram
) {
}
