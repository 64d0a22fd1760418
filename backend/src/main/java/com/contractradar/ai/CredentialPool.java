package com.contractradar.ai;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over API keys, shared by all concurrent runs. Blank keys are dropped.
 */
public class CredentialPool {

    private final String name;
    private final List<String> keys;
    private final AtomicInteger index = new AtomicInteger(0);

    public CredentialPool(String name, List<String> keys) {
        this.name = name;
        this.keys = keys == null ? List.of() : keys.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(k -> !k.isEmpty())
                .toList();
    }

    /**
     * @return next key in rotation, empty when no key is configured
     */
    public Optional<String> next() {
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        int i = Math.floorMod(index.getAndIncrement(), keys.size());
        return Optional.of(keys.get(i));
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public String getName() {
        return name;
    }
}
