package com.contractradar.reputation;

import com.contractradar.reputation.config.ReputationProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in registry of major Solana DEX and aggregator programs, extended by
 * {@code contractradar.reputation.known-programs}.
 */
@Component
public class DefaultKnownProgramRegistry implements KnownProgramRegistry {

    private final Map<String, String> nameByProgramId = new ConcurrentHashMap<>();

    public DefaultKnownProgramRegistry(ReputationProperties properties) {
        nameByProgramId.put("675kPX9MHTjS2zt1qfr1NYHuzeLXfQM9H24wFSUt1Mp8", "Raydium AMM v4");
        nameByProgramId.put("CAMMCzo5YL8w4VFF8KVHrK22GGUsp5VTaW7grrKgrWqK", "Raydium CLMM");
        nameByProgramId.put("CPMMoo8L3F4NbTegBCKVNunggL7H1ZpdTHKxQB5qKP1C", "Raydium CPMM");
        nameByProgramId.put("whirLbMiicVdio4qvUfM5KAg6Ct8VwpYzGff3uctyCc", "Orca Whirlpools");
        nameByProgramId.put("9W959DqEETiGZocYWCQPaJ6sBmUzgfxXfqGeTEdp3aQP", "Orca Token Swap v2");
        nameByProgramId.put("JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4", "Jupiter Aggregator v6");
        nameByProgramId.put("LBUZKhRxPF3XUpBCjp4YzTKgLccjZhTSDM9YuVaPwxo", "Meteora DLMM");
        nameByProgramId.put("Eo7WjKq67rjJQSZxS6z3YkapzY3eMj6Xy8X5EQVn5UaB", "Meteora Pools");
        nameByProgramId.put("PhoeNiXZ8ByJGLkxNfZRnkUfjvmuYqLR89jjFHGqdXY", "Phoenix");
        nameByProgramId.put("srmqPvymJeFKQ4zGQed1GFppgkRHB9kaELCbyksJtPX", "OpenBook");
        nameByProgramId.put("opnb2LAfJYbRMAHHvqjCwQxanZn7ReEHp1k81EohpZb", "OpenBook v2");
        nameByProgramId.put("6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P", "Pump.fun");
        if (properties.getKnownPrograms() != null) {
            properties.getKnownPrograms().forEach((id, name) -> {
                if (id != null && !id.isBlank() && name != null && !name.isBlank()) {
                    nameByProgramId.put(id.strip(), name.strip());
                }
            });
        }
    }

    @Override
    public Optional<String> getProgramName(String programId) {
        if (programId == null || programId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nameByProgramId.get(programId.strip()));
    }
}
