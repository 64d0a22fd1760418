package com.contractradar.detection;

import com.contractradar.chain.AccountInfo;
import com.contractradar.chain.SolanaChainClient;
import com.contractradar.domain.DetectionMode;
import org.springframework.stereotype.Component;

/**
 * Picks the detector for an account: mints go to the token detector, everything else is treated as a program.
 */
@Component
public class AccountClassifier {

    public enum OwnerKind { TOKEN_PROGRAM, TOKEN_2022_PROGRAM, UPGRADEABLE_LOADER, OTHER }

    public DetectionMode classify(AccountInfo account) {
        return account.isMint() ? DetectionMode.TOKEN : DetectionMode.DEX;
    }

    /** Owner program kind, informational only. */
    public OwnerKind ownerKind(AccountInfo account) {
        String owner = account.owner();
        if (SolanaChainClient.TOKEN_PROGRAM.equals(owner)) {
            return OwnerKind.TOKEN_PROGRAM;
        }
        if (SolanaChainClient.TOKEN_2022_PROGRAM.equals(owner)) {
            return OwnerKind.TOKEN_2022_PROGRAM;
        }
        if (SolanaChainClient.UPGRADEABLE_LOADER.equals(owner)) {
            return OwnerKind.UPGRADEABLE_LOADER;
        }
        return OwnerKind.OTHER;
    }

    /** Value reported as accountType in the account_type step. */
    public String accountType(AccountInfo account) {
        if (account.parsedType() != null) {
            return account.parsedType();
        }
        return account.executable() ? "program" : "unknown";
    }
}
