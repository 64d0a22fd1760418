package com.contractradar.reputation;

import com.contractradar.reputation.config.ReputationProperties;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configured set of known drainer / rug-pull addresses. Base58 is case-sensitive, so matching is exact.
 */
@Component
public class DrainerBlocklist {

    private final Set<String> addresses;

    public DrainerBlocklist(ReputationProperties properties) {
        this.addresses = properties.getDrainerBlocklist() == null ? Set.of()
                : properties.getDrainerBlocklist().stream()
                .filter(a -> a != null && !a.isBlank())
                .map(String::strip)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isKnownDrainer(String address) {
        return address != null && addresses.contains(address.strip());
    }

    public int size() {
        return addresses.size();
    }
}
