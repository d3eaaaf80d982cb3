package io.mockchain.core.consensus;

import java.util.Locale;

/** The closed set of consensus policies a node can run. */
public enum ConsensusType {
    PROOF_OF_WORK("pow"),
    PROOF_OF_STAKE("pos");

    private final String shortName;

    ConsensusType(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    /** Accepts the short name ("pow", "pos") or the enum constant name, case-insensitively. */
    public static ConsensusType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Consensus type required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ConsensusType type : values()) {
            if (type.shortName.equals(v) || type.name().toLowerCase(Locale.ROOT).equals(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown consensus type: " + value + " (expected pow or pos)");
    }
}
