package io.mockchain.core.consensus;

import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Hashes;
import io.mockchain.core.protocol.Transaction;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Stake-weighted validator selection without a hash search.
 *
 * A validator is eligible once its registered stake reaches {@code minStake}. The producer of
 * block {@code n} is drawn from the eligible set with probability proportional to stake, using
 * SHA-256(previousHash || n) as the random source, so every node with the same registry picks
 * the same validator for the same parent.
 */
public final class ProofOfStake implements ConsensusEngine {
    private static final Logger LOG = Logger.getLogger(ProofOfStake.class.getName());

    private final long minStake;
    private final Map<String, Long> stakes = new ConcurrentHashMap<>();
    private final Duration slotInterval;

    public ProofOfStake(long minStake, Map<String, Long> initialStakes, Duration slotInterval) {
        if (minStake < 0) {
            throw new IllegalArgumentException("minStake must be >= 0");
        }
        this.minStake = minStake;
        this.slotInterval = slotInterval == null ? ConsensusSettings.DEFAULT_SLOT_INTERVAL : slotInterval;
        if (initialStakes != null) {
            initialStakes.forEach(this::registerStake);
        }
    }

    public long minStake() { return minStake; }

    @Override
    public String name() {
        return "Proof of Stake";
    }

    @Override
    public Duration productionInterval() {
        return slotInterval;
    }

    /** Adds {@code stake} to whatever {@code validator} already has. */
    public void registerStake(String validator, long stake) {
        if (validator == null || validator.isBlank()) {
            throw new IllegalArgumentException("validator address required");
        }
        if (stake < 0) {
            throw new IllegalArgumentException("stake must be >= 0");
        }
        long total = stakes.merge(validator, stake, Math::addExact);
        LOG.fine(() -> "Validator " + validator + " stake now " + total);
    }

    public long stakeOf(String validator) {
        return stakes.getOrDefault(validator, 0L);
    }

    public boolean isEligible(String validator) {
        return validator != null && !validator.isBlank() && stakes.containsKey(validator) && stakeOf(validator) >= minStake;
    }

    /** Eligible validators in address order, with their stakes. */
    public Map<String, Long> eligibleValidators() {
        Map<String, Long> eligible = new TreeMap<>();
        stakes.forEach((addr, stake) -> {
            if (stake >= minStake) {
                eligible.put(addr, stake);
            }
        });
        return eligible;
    }

    /** Deterministic stake-weighted pick for the block at {@code index} on top of {@code previousHash}. */
    public Optional<String> selectValidator(String previousHash, long index) {
        Map<String, Long> eligible = eligibleValidators();
        BigInteger total = BigInteger.ZERO;
        List<String> addresses = new ArrayList<>(eligible.size());
        for (Map.Entry<String, Long> e : eligible.entrySet()) {
            addresses.add(e.getKey());
            total = total.add(BigInteger.valueOf(e.getValue()));
        }
        if (addresses.isEmpty()) {
            return Optional.empty();
        }
        if (total.signum() == 0) {
            // everyone staked zero with a zero threshold: fall back to a uniform pick
            int slot = seed(previousHash, index).mod(BigInteger.valueOf(addresses.size())).intValue();
            return Optional.of(addresses.get(slot));
        }
        BigInteger ticket = seed(previousHash, index).mod(total);
        BigInteger cumulative = BigInteger.ZERO;
        for (String address : addresses) {
            cumulative = cumulative.add(BigInteger.valueOf(eligible.get(address)));
            if (ticket.compareTo(cumulative) < 0) {
                return Optional.of(address);
            }
        }
        return Optional.of(addresses.get(addresses.size() - 1));
    }

    @Override
    public Optional<Block> generateBlock(long index, List<Transaction> transactions, String previousHash,
                                         BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            return Optional.empty();
        }
        String validator = selectValidator(previousHash, index)
                .orElseThrow(() -> new IllegalStateException("No validator with stake >= " + minStake));
        return Optional.of(Block.create(index, System.currentTimeMillis(), transactions, previousHash, 0L, validator));
    }

    @Override
    public boolean validateBlock(Block block, String previousHash) {
        if (block == null || !block.previousHash().equals(previousHash)) {
            return false;
        }
        if (!block.hash().equals(block.computeHash())) {
            return false;
        }
        return isEligible(block.miner());
    }

    private static BigInteger seed(String previousHash, long index) {
        byte[] prev = previousHash.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(prev.length + Long.BYTES);
        buf.put(prev).putLong(index);
        return new BigInteger(1, Hashes.sha256(buf.array()));
    }

    @Override
    public String toString() {
        return "ProofOfStake{minStake=" + minStake + ", validators=" + stakes.size() + "}";
    }
}
