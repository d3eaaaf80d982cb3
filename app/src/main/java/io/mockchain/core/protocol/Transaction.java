package io.mockchain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Optional;

import io.mockchain.core.protocol.TransactionRejectedException.Reason;

/**
 * Signed value transfer. Immutable; {@link #sign(PrivateKey)} returns a new instance.
 *
 * Canonical encoding (signed and hashed): from || to || amount || timestamp, big-endian,
 * strings as a 4-byte length followed by UTF-8 bytes, numbers as 8-byte longs.
 */
public final class Transaction {

    /** Reserved sender of system-minted faucet credits. Never has a key. */
    public static final String FAUCET_ADDRESS = "FAUCET_MOCKCHAIN_ADDRESS";

    private final String from;
    private final String to;
    private final long amount;
    private final long timestamp;
    private final byte[] signature;

    private final String id;

    private Transaction(String from, String to, long amount, long timestamp, byte[] signature) {
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.timestamp = timestamp;
        this.signature = signature != null ? signature.clone() : new byte[0];
        basicValidate();
        this.id = Hashes.toHex(Hashes.sha256(canonicalBytes()));
    }

    public static Builder builder() { return new Builder(); }

    /** System credit of {@code amount} to {@code to}; unsigned by construction. */
    public static Transaction faucet(String to, long amount, long timestamp) {
        return builder().from(FAUCET_ADDRESS).to(to).amount(amount).timestamp(timestamp).build();
    }

    public static final class Builder {
        private String from;
        private String to;
        private long amount;
        private long timestamp = System.currentTimeMillis();
        private byte[] signature = new byte[0];

        public Builder from(String f) { this.from = f; return this; }
        public Builder to(String t) { this.to = t; return this; }
        public Builder amount(long a) { this.amount = a; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder signature(byte[] s) { this.signature = s != null ? s.clone() : new byte[0]; return this; }

        public Transaction build() {
            return new Transaction(from, to, amount, timestamp, signature);
        }
    }

    // -------------------- getters --------------------
    public String from() { return from; }
    public String to() { return to; }
    public long amount() { return amount; }
    public long timestamp() { return timestamp; }
    public byte[] signature() { return signature.clone(); }
    public boolean isSigned() { return signature.length > 0; }

    /** Hex SHA-256 of the canonical encoding. Signatures are not part of the id. */
    public String id() { return id; }

    public boolean isFaucet() { return FAUCET_ADDRESS.equals(from); }

    // -------------------- crypto --------------------
    public byte[] signingDigest() {
        return Hashes.sha256(canonicalBytes());
    }

    public Transaction sign(PrivateKey privateKey) {
        byte[] sig = SignatureUtil.sign(signingDigest(), privateKey);
        return builder().from(from).to(to).amount(amount).timestamp(timestamp).signature(sig).build();
    }

    /**
     * Checks amount bounds and, for non-faucet transactions, the signature against the key
     * encoded in {@code from}.
     *
     * @throws TransactionRejectedException with {@code INVALID_AMOUNT} or {@code INVALID_SIGNATURE}
     */
    public void verify() {
        if (amount <= 0) {
            throw new TransactionRejectedException(Reason.INVALID_AMOUNT, "amount must be > 0, got " + amount);
        }
        if (isFaucet()) {
            return;
        }
        Optional<PublicKey> key = SignatureUtil.decodeAddress(from);
        if (key.isEmpty()) {
            throw new TransactionRejectedException(Reason.INVALID_SIGNATURE, "sender is not a valid public key");
        }
        if (!SignatureUtil.verify(signingDigest(), signature, key.get())) {
            throw new TransactionRejectedException(Reason.INVALID_SIGNATURE, "signature does not match sender");
        }
    }

    // -------------------- encoding --------------------
    public byte[] canonicalBytes() {
        byte[] f = from.getBytes(StandardCharsets.UTF_8);
        byte[] t = to.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + f.length + 4 + t.length + 8 + 8);
        putBytes(buf, f);
        putBytes(buf, t);
        buf.putLong(amount);
        buf.putLong(timestamp);
        return buf.array();
    }

    /** Canonical encoding followed by the length-prefixed signature; what a block commits to. */
    public byte[] serialize() {
        byte[] unsigned = canonicalBytes();
        ByteBuffer buf = ByteBuffer.allocate(unsigned.length + 4 + signature.length);
        buf.put(unsigned);
        putBytes(buf, signature);
        return buf.array();
    }

    private void basicValidate() {
        if (from == null || from.isBlank()) throw new IllegalArgumentException("Missing from");
        if (to == null || to.isBlank()) throw new IllegalArgumentException("Missing to");
    }

    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return id.equals(other.id) && Arrays.equals(signature, other.signature);
    }

    @Override public int hashCode() { return id.hashCode(); }

    @Override public String toString() {
        return "Transaction{" + abbreviate(from) + " -> " + abbreviate(to) + ", amount=" + amount + "}";
    }

    private static String abbreviate(String address) {
        return address.length() <= 16 ? address : address.substring(address.length() - 12);
    }
}
