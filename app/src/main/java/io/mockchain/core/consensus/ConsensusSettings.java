package io.mockchain.core.consensus;

import io.mockchain.core.protocol.ProtocolLimits;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Startup-time consensus selection. Consumed once when the node is built; the resulting
 * engine stays active for the ledger's whole lifetime.
 */
public record ConsensusSettings(
        ConsensusType type,
        int difficulty,
        long minStake,
        Map<String, Long> validatorStakes,
        Duration slotInterval
) {
    public static final int DEFAULT_DIFFICULTY = 3;
    public static final long DEFAULT_MIN_STAKE = 100L;
    public static final Duration DEFAULT_SLOT_INTERVAL = Duration.ofSeconds(10);

    public ConsensusSettings {
        Objects.requireNonNull(type, "type");
        if (difficulty < 0 || difficulty > ProtocolLimits.MAX_DIFFICULTY) {
            throw new IllegalArgumentException("difficulty must be in 0.." + ProtocolLimits.MAX_DIFFICULTY + ", got " + difficulty);
        }
        if (minStake < 0) {
            throw new IllegalArgumentException("minStake must be >= 0");
        }
        validatorStakes = validatorStakes == null ? Map.of() : Map.copyOf(validatorStakes);
        slotInterval = slotInterval == null ? DEFAULT_SLOT_INTERVAL : slotInterval;
        if (slotInterval.isNegative()) {
            throw new IllegalArgumentException("slotInterval must not be negative");
        }
    }

    public static ConsensusSettings proofOfWork(int difficulty) {
        return new ConsensusSettings(ConsensusType.PROOF_OF_WORK, difficulty, DEFAULT_MIN_STAKE, Map.of(), DEFAULT_SLOT_INTERVAL);
    }

    public static ConsensusSettings proofOfStake(long minStake, Map<String, Long> validatorStakes) {
        return new ConsensusSettings(ConsensusType.PROOF_OF_STAKE, DEFAULT_DIFFICULTY, minStake, validatorStakes, DEFAULT_SLOT_INTERVAL);
    }

    public ConsensusSettings withSlotInterval(Duration interval) {
        return new ConsensusSettings(type, difficulty, minStake, validatorStakes, interval);
    }

    /**
     * Builds the engine. Under proof of stake a non-blank {@code localAddress} is registered
     * with {@code minStake} when no stake was configured for it, so a single node can produce.
     */
    public ConsensusEngine create(String localAddress) {
        switch (type) {
            case PROOF_OF_WORK:
                return new ProofOfWork(difficulty, localAddress);
            case PROOF_OF_STAKE:
                Map<String, Long> stakes = new LinkedHashMap<>(validatorStakes);
                if (localAddress != null && !localAddress.isBlank() && !stakes.containsKey(localAddress)) {
                    stakes.put(localAddress, minStake);
                }
                return new ProofOfStake(minStake, stakes, slotInterval);
            default:
                throw new IllegalStateException("Unhandled consensus type " + type);
        }
    }

    public String describe() {
        return type == ConsensusType.PROOF_OF_WORK
                ? "ProofOfWork{difficulty=" + difficulty + "}"
                : "ProofOfStake{minStake=" + minStake + ", validators=" + validatorStakes.size() + "}";
    }
}
