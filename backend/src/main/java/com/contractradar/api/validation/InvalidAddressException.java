package com.contractradar.api.validation;

import lombok.Getter;

/**
 * Rejected address; carries the error code returned in the 400 body.
 */
@Getter
public class InvalidAddressException extends RuntimeException {

    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String ADDRESS_REQUIRED = "ADDRESS_REQUIRED";

    private final String code;

    public InvalidAddressException(String code, String message) {
        super(message);
        this.code = code;
    }
}
