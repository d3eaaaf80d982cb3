package io.mockchain.core.wallet;

import io.mockchain.core.protocol.SignatureUtil;
import io.mockchain.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WalletTest {

    @Test
    void addressDecodesBackToPublicKey() {
        Wallet wallet = Wallet.generate();

        assertEquals(wallet.getPublicKey(), SignatureUtil.decodeAddress(wallet.getAddress()).orElseThrow());
        assertEquals(wallet.getAddress(), SignatureUtil.deriveAddress(wallet.getPublicKey()));
    }

    @Test
    void distinctWalletsHaveDistinctAddresses() {
        assertNotEquals(Wallet.generate().getAddress(), Wallet.generate().getAddress());
    }

    @Test
    void transferIsSignedBySender() {
        Wallet alice = Wallet.generate();
        Transaction tx = alice.transfer("bob", 12);

        assertTrue(SignatureUtil.verify(tx.signingDigest(), tx.signature(), alice.getPublicKey()));
        assertFalse(SignatureUtil.verify(tx.signingDigest(), tx.signature(), Wallet.generate().getPublicKey()));
    }

    @Test
    void malformedInputsNeverVerify() {
        Wallet alice = Wallet.generate();

        assertFalse(SignatureUtil.verify(new byte[32], new byte[] {1, 2, 3}, alice.getPublicKey()));
        assertTrue(SignatureUtil.decodeAddress("not-hex").isEmpty());
        assertTrue(SignatureUtil.decodeAddress("abcd").isEmpty());
    }
}
