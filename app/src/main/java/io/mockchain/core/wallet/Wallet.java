package io.mockchain.core.wallet;

import io.mockchain.core.protocol.SignatureUtil;
import io.mockchain.core.protocol.Transaction;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * An EC key pair whose address is the hex-encoded public key.
 */
public class Wallet {
    private final KeyPair keyPair;
    private final String address;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = SignatureUtil.deriveAddress(keyPair.getPublic());
    }

    public static Wallet generate() {
        return new Wallet(SignatureUtil.generateKeyPair());
    }

    public String getAddress() {
        return address;
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    /** Build and sign a transfer of {@code amount} from this wallet, timestamped now. */
    public Transaction transfer(String to, long amount) {
        return transfer(to, amount, System.currentTimeMillis());
    }

    public Transaction transfer(String to, long amount, long timestamp) {
        return Transaction.builder()
                .from(address)
                .to(to)
                .amount(amount)
                .timestamp(timestamp)
                .build()
                .sign(getPrivateKey());
    }
}
