package org.nostrpool.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * BIP-340 Schnorr signatures over secp256k1 using BouncyCastle (pure Java, no JNI).
 * See: https://github.com/bitcoin/bips/blob/master/bip-0340.mediawiki
 */
public final class SchnorrSigner {

    private static final ECNamedCurveParameterSpec CURVE_PARAMS = ECNamedCurveTable.getParameterSpec("secp256k1");
    private static final BigInteger N = CURVE_PARAMS.getN();
    private static final BigInteger P = CURVE_PARAMS.getCurve().getField().getCharacteristic();
    private static final ECPoint G = CURVE_PARAMS.getG();

    private static final byte[] NONCE_TAG = taggedHashPrefix("BIP0340/nonce");
    private static final byte[] CHALLENGE_TAG = taggedHashPrefix("BIP0340/challenge");

    /**
     * Derive the x-only public key for a private key.
     *
     * @param privateKey 32-byte private key
     * @return 32-byte x-only public key
     */
    public static byte[] getPublicKey(byte[] privateKey) {
        BigInteger d = toScalar(privateKey);
        return xOnly(G.multiply(d).normalize());
    }

    /**
     * Sign a 32-byte message (an event id).
     *
     * @param message 32-byte message
     * @param privateKey 32-byte private key
     * @return 64-byte signature (R.x || s)
     */
    public static byte[] sign(byte[] message, byte[] privateKey) {
        if (message.length != 32) {
            throw new IllegalArgumentException("Message must be 32 bytes");
        }
        BigInteger d = toScalar(privateKey);
        ECPoint publicPoint = G.multiply(d).normalize();
        if (publicPoint.getAffineYCoord().toBigInteger().testBit(0)) {
            d = N.subtract(d);
        }
        byte[] px = xOnly(publicPoint);

        // Deterministic nonce from the even-y secret and the message
        BigInteger k = new BigInteger(1, taggedHash(NONCE_TAG,
                Arrays.concatenate(BigIntegers.asUnsignedByteArray(32, d), px, message))).mod(N);
        if (k.signum() == 0) {
            throw new IllegalStateException("Derived nonce is zero");
        }

        ECPoint r = G.multiply(k).normalize();
        if (r.getAffineYCoord().toBigInteger().testBit(0)) {
            k = N.subtract(k);
        }
        byte[] rx = xOnly(r);

        BigInteger e = challenge(rx, px, message);
        BigInteger s = k.add(e.multiply(d)).mod(N);
        return Arrays.concatenate(rx, BigIntegers.asUnsignedByteArray(32, s));
    }

    /**
     * Verify a BIP-340 signature.
     *
     * @param signature 64-byte signature
     * @param message 32-byte message
     * @param publicKey 32-byte x-only public key
     * @return true if the signature is valid
     */
    public static boolean verify(byte[] signature, byte[] message, byte[] publicKey) {
        if (signature.length != 64 || message.length != 32 || publicKey.length != 32) {
            return false;
        }
        byte[] rx = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rx);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) {
            return false;
        }

        ECPoint publicPoint = liftX(publicKey);
        if (publicPoint == null) {
            return false;
        }

        BigInteger e = challenge(rx, publicKey, message);
        ECPoint point = G.multiply(s).add(publicPoint.multiply(N.subtract(e))).normalize();
        if (point.isInfinity() || point.getAffineYCoord().toBigInteger().testBit(0)) {
            return false;
        }
        return point.getAffineXCoord().toBigInteger().equals(r);
    }

    private static BigInteger challenge(byte[] rx, byte[] px, byte[] message) {
        return new BigInteger(1, taggedHash(CHALLENGE_TAG, Arrays.concatenate(rx, px, message))).mod(N);
    }

    /**
     * Point with the given x coordinate and even y, or null if x is not on the curve.
     */
    private static ECPoint liftX(byte[] x) {
        BigInteger xValue = new BigInteger(1, x);
        if (xValue.compareTo(P) >= 0) {
            return null;
        }
        try {
            // Compressed encoding with prefix 0x02 selects the even y
            return CURVE_PARAMS.getCurve().decodePoint(Arrays.prepend(x, (byte) 0x02)).normalize();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static BigInteger toScalar(byte[] privateKey) {
        if (privateKey.length != 32) {
            throw new IllegalArgumentException("Private key must be 32 bytes");
        }
        BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("Private key out of range");
        }
        return d;
    }

    private static byte[] xOnly(ECPoint point) {
        return BigIntegers.asUnsignedByteArray(32, point.getAffineXCoord().toBigInteger());
    }

    private static byte[] taggedHashPrefix(String tag) {
        byte[] tagHash = sha256(tag.getBytes(StandardCharsets.UTF_8));
        return Arrays.concatenate(tagHash, tagHash);
    }

    private static byte[] taggedHash(byte[] prefix, byte[] message) {
        return sha256(Arrays.concatenate(prefix, message));
    }

    static byte[] sha256(byte[] input) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private SchnorrSigner() {
        // Utility class
    }
}
