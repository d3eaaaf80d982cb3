package io.mockchain.core.consensus;

import io.mockchain.core.protocol.Block;
import io.mockchain.core.protocol.Hashes;
import io.mockchain.core.protocol.ProtocolLimits;
import io.mockchain.core.protocol.Transaction;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Minimal Proof-of-Work:
 * - difficulty = required count of leading '0' characters in the hex block hash.
 * - Hash = SHA-256(block.hashPreimage()).
 *
 * Example:
 *   difficulty = 4  -> hash must start with "0000" (16 zero bits).
 *
 * Notes:
 * - Blocks are immutable, so the search rewrites the nonce bytes of one preimage buffer and
 *   only builds a Block once a winning nonce is found.
 * - Timestamp stays fixed for the whole search.
 */
public final class ProofOfWork implements ConsensusEngine {

    /** Nonces between two polls of the cancellation flag. */
    static final long CANCEL_CHECK_INTERVAL = 4096L;

    private final int difficulty;
    private final String minerAddress;

    public ProofOfWork(int difficulty, String minerAddress) {
        if (difficulty < 0 || difficulty > ProtocolLimits.MAX_DIFFICULTY) {
            throw new IllegalArgumentException("difficulty must be in 0.." + ProtocolLimits.MAX_DIFFICULTY);
        }
        this.difficulty = difficulty;
        this.minerAddress = minerAddress == null ? "" : minerAddress;
    }

    public int difficulty() { return difficulty; }
    public String minerAddress() { return minerAddress; }

    @Override
    public String name() {
        return "Proof of Work";
    }

    @Override
    public Duration productionInterval() {
        return Duration.ZERO;
    }

    /** Quick check: does this hash meet the configured difficulty? */
    public boolean meetsTarget(String hexHash) {
        if (hexHash == null || hexHash.length() < difficulty) return false;
        for (int i = 0; i < difficulty; i++) {
            if (hexHash.charAt(i) != '0') return false;
        }
        return true;
    }

    @Override
    public Optional<Block> generateBlock(long index, List<Transaction> transactions, String previousHash,
                                         BooleanSupplier cancelled) {
        Block template = Block.create(index, System.currentTimeMillis(), transactions, previousHash, 0L, minerAddress);

        byte[] preimage = template.hashPreimage();
        ByteBuffer slot = ByteBuffer.wrap(preimage);
        int nonceOffset = preimage.length - Long.BYTES;
        MessageDigest sha = Hashes.newSha256();

        // Tight loop: rewrite nonce, rehash, compare nibbles
        for (long nonce = 0; nonce < Long.MAX_VALUE; nonce++) {
            if (nonce % CANCEL_CHECK_INTERVAL == 0 && cancelled.getAsBoolean()) {
                return Optional.empty();
            }
            slot.putLong(nonceOffset, nonce);
            byte[] hash = sha.digest(preimage);
            if (Hashes.leadingZeroHexDigits(hash) >= difficulty) {
                return Optional.of(new Block(template.index(), template.timestamp(), template.transactions(),
                        template.previousHash(), Hashes.toHex(hash), nonce, template.miner()));
            }
        }
        throw new IllegalStateException("nonce space exhausted at index " + index);
    }

    @Override
    public boolean validateBlock(Block block, String previousHash) {
        if (block == null || !block.previousHash().equals(previousHash)) {
            return false;
        }
        if (!block.hash().equals(block.computeHash())) {
            return false;
        }
        return meetsTarget(block.hash());
    }

    @Override
    public String toString() {
        return "ProofOfWork{difficulty=" + difficulty + "}";
    }
}
