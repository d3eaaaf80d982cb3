package io.mockchain.core.protocol;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ECDSA over secp256r1. Addresses are the hex form of the X.509-encoded public key,
 * so a verifier can recover the key from the sender field alone.
 */
public final class SignatureUtil {
    private static final Logger LOG = Logger.getLogger(SignatureUtil.class.getName());
    private static final String ALGORITHM = "SHA256withECDSA";
    private static final String CURVE = "secp256r1";

    private SignatureUtil() {}

    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator gen = KeyPairGenerator.getInstance("EC");
            gen.initialize(new ECGenParameterSpec(CURVE));
            return gen.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation failed", e);
        }
    }

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    /** False on mismatch and on any malformed key or signature encoding. */
    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        if (pub == null || signature == null || signature.length == 0) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "Signature check failed: " + e.getMessage());
            return false;
        }
    }

    public static String deriveAddress(PublicKey pub) {
        return Hashes.toHex(pub.getEncoded());
    }

    /** Parse an address back into a public key; empty if it is not a valid EC key encoding. */
    public static Optional<PublicKey> decodeAddress(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        try {
            byte[] encoded = Hashes.fromHex(address);
            KeyFactory factory = KeyFactory.getInstance("EC");
            return Optional.of(factory.generatePublic(new X509EncodedKeySpec(encoded)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "Malformed sender key: " + e.getMessage());
            return Optional.empty();
        }
    }
}
