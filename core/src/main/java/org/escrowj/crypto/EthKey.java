/*
 * Copyright by the original author or authors.
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.escrowj.crypto;

import com.google.common.base.MoreObjects;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.escrowj.core.Address;
import org.escrowj.core.Bytes32;
import org.escrowj.core.Utils;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Represents a secp256k1 key pair, or just the public half. Keys are identified by their {@link Address}, which
 * is what escrows store for every role: the trade keys of both parties and the escrower's refund key.</p>
 *
 * <p>Signatures are deterministic (RFC 6979) and always canonical (low S), and carry the recovery id so the
 * signer's address can be recovered from the digest and signature alone. That recovery is how an escrow checks
 * authorization: it never holds public keys, only the addresses they hash to.</p>
 *
 * <p>This class is immutable and thread safe.</p>
 */
public class EthKey {
    // The parameters of the secp256k1 curve.
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** The parameters of the secp256k1 curve that Ethereum and Bitcoin use. */
    public static final ECDomainParameters CURVE;

    /**
     * Equal to CURVE.getN().shiftRight(1), used for canonicalising the S value of a signature.
     */
    public static final BigInteger HALF_CURVE_ORDER;

    private static final SecureRandom secureRandom;

    static {
        CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(),
                CURVE_PARAMS.getH());
        HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);
        secureRandom = new SecureRandom();
    }

    @Nullable private final BigInteger priv;
    private final ECPoint pub;
    private final Address address;

    /**
     * Generates an entirely new keypair. Point compression is irrelevant here: addresses are always derived from
     * the uncompressed encoding.
     */
    public EthKey() {
        this(secureRandom);
    }

    /**
     * Generates an entirely new keypair with the given {@link SecureRandom} object.
     */
    public EthKey(SecureRandom secureRandom) {
        ECKeyPairGenerator generator = new ECKeyPairGenerator();
        ECKeyGenerationParameters keygenParams = new ECKeyGenerationParameters(CURVE, secureRandom);
        generator.init(keygenParams);
        AsymmetricCipherKeyPair keypair = generator.generateKeyPair();
        ECPrivateKeyParameters privParams = (ECPrivateKeyParameters) keypair.getPrivate();
        ECPublicKeyParameters pubParams = (ECPublicKeyParameters) keypair.getPublic();
        this.priv = privParams.getD();
        this.pub = pubParams.getQ().normalize();
        this.address = addressFromPoint(pub);
    }

    protected EthKey(@Nullable BigInteger priv, ECPoint pub) {
        if (priv != null) {
            checkArgument(priv.bitLength() <= 32 * 8, "private key exceeds 32 bytes: %s bits", priv.bitLength());
            checkArgument(priv.signum() > 0 && priv.compareTo(CURVE.getN()) < 0, "private key out of range");
        }
        this.priv = priv;
        this.pub = checkNotNull(pub).normalize();
        this.address = addressFromPoint(this.pub);
    }

    /**
     * Creates an EthKey given the private key only. The public key is calculated from it.
     */
    public static EthKey fromPrivate(BigInteger privKey) {
        return new EthKey(privKey, publicPointFromPrivate(privKey));
    }

    /**
     * Creates an EthKey given the 32 byte big endian private key only. The public key is calculated from it.
     */
    public static EthKey fromPrivate(byte[] privKeyBytes) {
        checkArgument(privKeyBytes.length == 32, "Private keys are 32 bytes, got %s", privKeyBytes.length);
        return fromPrivate(new BigInteger(1, privKeyBytes));
    }

    /**
     * Creates an EthKey that cannot be used for signing, only for identifying a role. The given bytes are an encoded
     * public key point, compressed or not.
     */
    public static EthKey fromPublicOnly(byte[] pub) {
        return new EthKey(null, CURVE.getCurve().decodePoint(pub));
    }

    /**
     * Returns public key point from the given private key. To convert a byte array into a BigInteger,
     * use {@code new BigInteger(1, bytes);}
     */
    public static ECPoint publicPointFromPrivate(BigInteger privKey) {
        checkArgument(privKey.signum() > 0 && privKey.compareTo(CURVE.getN()) < 0, "private key out of range");
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privKey);
    }

    /** Hashes the 64 byte uncompressed point (without the 0x04 marker) and keeps the last 20 bytes. */
    public static Address addressFromPoint(ECPoint point) {
        byte[] encoded = point.normalize().getEncoded(false);
        return Address.fromDigest(Bytes32.wrap(Utils.keccak256(encoded, 1, encoded.length - 1)));
    }

    /** Returns true if this key has access to private key bytes and so can sign. */
    public boolean hasPrivKey() {
        return priv != null;
    }

    /**
     * Gets the private key in the form of an integer field element. The public key is derived by performing EC
     * point addition this number of times (i.e. point multiplying).
     *
     * @throws java.lang.IllegalStateException if the private key bytes are not available.
     */
    public BigInteger getPrivKey() {
        checkState(priv != null, "Private key is not available");
        return priv;
    }

    /** Returns the 65 byte uncompressed encoding of the public key. */
    public byte[] getPubKey() {
        return pub.getEncoded(false);
    }

    /** Returns the public key as an elliptic curve point. */
    public ECPoint getPubKeyPoint() {
        return pub;
    }

    /** Returns the address that signatures made by this key recover to. */
    public Address getAddress() {
        return address;
    }

    /**
     * Signs the given 32 byte digest. The digest is signed as is: callers that want the signed message convention
     * must build the digest with {@link org.escrowj.escrow.EscrowMessages#toSignableDigest(org.escrowj.core.EscrowParameters, byte[])} first.
     *
     * @throws IllegalStateException if this key has no private part.
     */
    public EthSignature sign(Bytes32 digest) {
        checkState(priv != null, "Cannot sign with a public-only key");
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        ECPrivateKeyParameters privKey = new ECPrivateKeyParameters(priv, CURVE);
        signer.init(true, privKey);
        BigInteger[] components = signer.generateSignature(digest.getBytes());
        BigInteger r = components[0];
        BigInteger s = components[1];
        if (s.compareTo(HALF_CURVE_ORDER) > 0)
            s = CURVE.getN().subtract(s);
        // Now we have to work backwards to figure out the recId needed to recover the signature.
        for (int recId = 0; recId < 2; recId++) {
            ECPoint k = recoverFromSignature(recId, r, s, digest);
            if (k != null && k.equals(pub))
                return new EthSignature(r, s, recId);
        }
        throw new IllegalStateException("Could not construct a recoverable key. This should never happen.");
    }

    /**
     * Verifies the given signature against this key with plain ECDSA verification, without recovery.
     */
    public boolean verify(Bytes32 digest, EthSignature signature) {
        ECDSASigner signer = new ECDSASigner();
        ECPublicKeyParameters params = new ECPublicKeyParameters(pub, CURVE);
        signer.init(false, params);
        return signer.verifySignature(digest.getBytes(), signature.r, signature.s);
    }

    /**
     * Returns the address that signed the given digest, or null if no key can be recovered from the signature.
     */
    @Nullable
    public static Address recoverAddress(Bytes32 digest, EthSignature signature) {
        ECPoint point = recoverFromSignature(signature.recId, signature.r, signature.s, digest);
        return point == null ? null : addressFromPoint(point);
    }

    /**
     * <p>Given the components of a signature and a selector value, recover and return the public key
     * that generated the signature according to the algorithm in SEC1v2 section 4.1.6.</p>
     *
     * <p>The recId is an index from 0 to 3 which indicates which of the 4 possible keys is the correct one. Because
     * the key recovery operation yields multiple potential keys, the correct key must either be stored alongside the
     * signature, or you must be willing to try each recId in turn until you find one that outputs the key you are
     * expecting. Only 0 and 1 occur in practice, since x coordinates at or above the curve order are astronomically
     * unlikely.</p>
     *
     * @param recId Which possible key to recover.
     * @param r The R component of the signature.
     * @param s The S component of the signature.
     * @param digest Hash of the data that was signed.
     * @return An ECPoint, or null if the key cannot be recovered.
     */
    @Nullable
    public static ECPoint recoverFromSignature(int recId, BigInteger r, BigInteger s, Bytes32 digest) {
        checkArgument(recId >= 0, "recId must be positive");
        checkArgument(r.signum() >= 0, "r must be positive");
        checkArgument(s.signum() >= 0, "s must be positive");
        BigInteger n = CURVE.getN();
        if (r.signum() == 0 || r.compareTo(n) >= 0 || s.signum() == 0 || s.compareTo(n) >= 0)
            return null;
        // 1.1 Let x = r + jn
        BigInteger i = BigInteger.valueOf((long) recId / 2);
        BigInteger x = r.add(i.multiply(n));
        //   1.2. Convert the integer x to an octet string X of length mlen using the conversion routine
        //        specified in Section 2.3.7, where mlen = ⌈(log2 p)/8⌉ or mlen = ⌈m/8⌉.
        //   1.3. Convert the octet string (16 set binary digits)||X to an elliptic curve point R using the
        //        conversion routine specified in Section 2.3.4. If this conversion routine outputs "invalid", then
        //        do another iteration of Step 1.
        BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
        if (x.compareTo(prime) >= 0) {
            // Cannot have point co-ordinates larger than this as everything takes place modulo Q.
            return null;
        }
        ECPoint R;
        try {
            R = decompressKey(x, (recId & 1) == 1);
        } catch (IllegalArgumentException e) {
            // x is not the x co-ordinate of any point on the curve.
            return null;
        }
        //   1.4. If nR != point at infinity, then do another iteration of Step 1 (callers responsibility).
        if (!R.multiply(n).isInfinity())
            return null;
        //   1.5. Compute e from M using Steps 2 and 3 of ECDSA signature verification.
        BigInteger e = digest.toBigInteger();
        //   1.6. For k from 1 to 2 do the following.   (loop is outside this function via iterating recId)
        //   1.6.1. Compute a candidate public key as:
        //               Q = mi(r) * (sR - eG)
        //
        // Where mi(x) is the modular multiplicative inverse. We transform this into the following:
        //               Q = (mi(r) * s ** R) + (mi(r) * -e ** G)
        // Where -e is the modular additive inverse of e, that is z such that z + e = 0 (mod n). In the above equation
        // ** is point multiplication and + is point addition (the EC group operator).
        //
        // We can find the additive inverse by subtracting e from zero then taking the mod. For example the additive
        // inverse of 3 modulo 11 is 8 because 3 + 8 mod 11 = 0, and -3 mod 11 = 8.
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, R, srInv);
        if (q.isInfinity())
            return null;
        return q.normalize();
    }

    /** Decompress a compressed public key (x co-ord and low-bit of y-coord). */
    private static ECPoint decompressKey(BigInteger xBN, boolean yBit) {
        X9IntegerConverter x9 = new X9IntegerConverter();
        byte[] compEnc = x9.integerToBytes(xBN, 1 + x9.getByteLength(CURVE.getCurve()));
        compEnc[0] = (byte) (yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compEnc);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || !(o instanceof EthKey)) return false;
        EthKey other = (EthKey) o;
        return Arrays.equals(getPubKey(), other.getPubKey());
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("address", address)
                .add("isPubKeyOnly", priv == null)
                .toString();
    }
}
