package com.contractradar.reputation;

import java.util.Optional;

/**
 * Maps well-known Solana program ids to display names. Used to flag unidentified programs.
 */
public interface KnownProgramRegistry {

    Optional<String> getProgramName(String programId);
}
