package io.mockchain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block = linking metadata + ordered transactions + content hash.
 *
 * Hash preimage: index || timestamp || previousHash || miner || txCount || tx[i] || nonce.
 * The nonce sits in the last 8 bytes so a hash search can rewrite it in place.
 */
public final class Block {

    /** previousHash of the genesis block. */
    public static final String GENESIS_PREVIOUS_HASH = "0";

    private final long index;
    private final long timestamp;
    private final List<Transaction> transactions;
    private final String previousHash;
    private final String hash;
    private final long nonce;
    private final String miner;

    /**
     * Rebuilds a block from all of its fields, including a stored hash that is taken as-is.
     * Use {@link #create} to compute the hash instead.
     */
    public Block(long index, long timestamp, List<Transaction> txs, String previousHash,
                 String hash, long nonce, String miner) {
        this.index = index;
        this.timestamp = timestamp;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        this.previousHash = Objects.requireNonNull(previousHash, "previousHash");
        this.hash = Objects.requireNonNull(hash, "hash");
        this.nonce = nonce;
        this.miner = miner != null ? miner : "";
        basicValidate();
    }

    public static Block create(long index, long timestamp, List<Transaction> txs, String previousHash,
                               long nonce, String miner) {
        Block unhashed = new Block(index, timestamp, txs, previousHash, "", nonce, miner);
        return unhashed.withHash(unhashed.computeHash());
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public List<Transaction> transactions() { return transactions; }
    public String previousHash() { return previousHash; }
    public String hash() { return hash; }
    public long nonce() { return nonce; }
    public String miner() { return miner; }
    public boolean hasMiner() { return !miner.isBlank(); }

    public String computeHash() {
        return Hashes.toHex(Hashes.sha256(hashPreimage()));
    }

    public byte[] hashPreimage() {
        byte[] prev = previousHash.getBytes(StandardCharsets.UTF_8);
        byte[] minerBytes = miner.getBytes(StandardCharsets.UTF_8);
        List<byte[]> encodedTxs = new ArrayList<>(transactions.size());
        int size = 8 + 8 + 4 + prev.length + 4 + minerBytes.length + 4;
        for (Transaction tx : transactions) {
            byte[] b = tx.serialize();
            encodedTxs.add(b);
            size += 4 + b.length;
        }
        size += 8;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putLong(index);
        buf.putLong(timestamp);
        buf.putInt(prev.length).put(prev);
        buf.putInt(minerBytes.length).put(minerBytes);
        buf.putInt(encodedTxs.size());
        for (byte[] b : encodedTxs) {
            buf.putInt(b.length).put(b);
        }
        buf.putLong(nonce);
        return buf.array();
    }

    public Block withNonce(long newNonce) {
        return create(index, timestamp, transactions, previousHash, newNonce, miner);
    }

    /** Same fields with a different stored hash; for hash searches that computed it themselves. */
    public Block withHash(String newHash) {
        return new Block(index, timestamp, transactions, previousHash, newHash, nonce, miner);
    }

    public boolean isGenesis() {
        return index == 0 && GENESIS_PREVIOUS_HASH.equals(previousHash);
    }

    private void basicValidate() {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override public String toString() {
        return "Block{index=" + index + ", txs=" + transactions.size() + ", hash=" + abbreviate(hash) + "}";
    }

    private static String abbreviate(String h) {
        return h.length() <= 12 ? h : h.substring(0, 12) + "…";
    }
}
