package intoto.crypto;

import intoto.model.Util;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Security;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * Ed25519 signing via BouncyCastle.
 * The default scheme for in-toto functionaries.
 */
public class Ed25519Signer implements Signer {

    private static final String PROVIDER = "BC";

    // DER prefixes of an Ed25519 SubjectPublicKeyInfo and of a PKCS#8 seed-form private key
    private static final byte[] X509_PREFIX = {
            0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00};
    private static final byte[] PKCS8_PREFIX = {
            0x30, 0x2e, 0x02, 0x01, 0x00, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70,
            0x04, 0x22, 0x04, 0x20};

    static {
        if (Security.getProvider(PROVIDER) == null) {
            Security.addProvider(new org.bouncycastle.jce.provider.BouncyCastleProvider());
        }
    }

    @Override
    public String algorithmName() {
        return "Ed25519";
    }

    @Override
    public KeyPair generateKeyPair() {
        try {
            KeyPairGenerator kpg = KeyPairGenerator.getInstance("Ed25519", PROVIDER);
            return kpg.generateKeyPair();
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public KeyPair deriveKeyPair(String label) {
        try {
            byte[] seed = Util.sha256(label.getBytes(java.nio.charset.StandardCharsets.UTF_8));
            Ed25519PrivateKeyParameters privParams = new Ed25519PrivateKeyParameters(seed, 0);
            Ed25519PublicKeyParameters pubParams = privParams.generatePublicKey();

            PublicKey pub = decodePublicKey(Util.concat(X509_PREFIX, pubParams.getEncoded()));
            PrivateKey priv = decodePrivateKey(Util.concat(PKCS8_PREFIX, seed));
            return new KeyPair(pub, priv);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public byte[] sign(byte[] data, PrivateKey privateKey) {
        try {
            Signature sig = Signature.getInstance("Ed25519", PROVIDER);
            sig.initSign(privateKey);
            sig.update(data);
            return sig.sign();
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public boolean verify(byte[] data, byte[] signature, PublicKey publicKey) {
        try {
            Signature sig = Signature.getInstance("Ed25519", PROVIDER);
            sig.initVerify(publicKey);
            sig.update(data);
            return sig.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    @Override
    public PublicKey decodePublicKey(byte[] spki) throws GeneralSecurityException {
        return KeyFactory.getInstance("Ed25519", PROVIDER).generatePublic(new X509EncodedKeySpec(spki));
    }

    @Override
    public PrivateKey decodePrivateKey(byte[] pkcs8) throws GeneralSecurityException {
        return KeyFactory.getInstance("Ed25519", PROVIDER).generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
    }
}
