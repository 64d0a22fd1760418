package com.contractradar.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates the address query parameter of the analyze endpoint.
 */
@Component
public class AddressValidator {

    /** Solana Base58: 32-44 chars, no 0, O, I or l. */
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return SOLANA_ADDRESS.matcher(address.trim()).matches();
    }

    /**
     * @return the trimmed address
     * @throws InvalidAddressException when missing or malformed
     */
    public String requireValid(String address) {
        if (address == null || address.isBlank()) {
            throw new InvalidAddressException(InvalidAddressException.ADDRESS_REQUIRED, "Address is required");
        }
        if (!isValidAddress(address)) {
            throw new InvalidAddressException(InvalidAddressException.INVALID_ADDRESS, "Invalid Solana address format");
        }
        return address.trim();
    }
}
