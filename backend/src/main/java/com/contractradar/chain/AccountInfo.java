package com.contractradar.chain;

/**
 * Subset of {@code getAccountInfo} (jsonParsed) needed to classify and analyze an account.
 *
 * @param parsedType        {@code data.parsed.type}, e.g. "mint" or "program"; null for unparsed accounts
 * @param mint              present only when parsedType is "mint"
 * @param programDataAddress present only for upgradeable-loader programs
 */
public record AccountInfo(
        String address,
        String owner,
        boolean executable,
        long lamports,
        String parsedType,
        MintInfo mint,
        String programDataAddress
) {

    public boolean isMint() {
        return "mint".equals(parsedType);
    }
}
