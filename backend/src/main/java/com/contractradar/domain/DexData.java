package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Program-mode payload of a detection result.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DexData(
        String programId,
        String programName,
        String ownerProgram,
        Boolean upgradeable,
        String upgradeAuthority,
        Double tvl,
        Double volume24h,
        Integer transactionCount,
        Double recentErrorRate,
        Double maxPriceChange1h,
        Integer pairs
) {
}
