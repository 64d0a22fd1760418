package com.contractradar.chain;

/**
 * Upgradeable-loader programData account. A null authority means the program is immutable.
 */
public record ProgramDataInfo(String address, String upgradeAuthority, Long slot) {

    public boolean upgradeable() {
        return upgradeAuthority != null;
    }
}
