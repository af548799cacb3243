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
import com.google.common.base.Objects;
import org.escrowj.core.Utils;

import java.math.BigInteger;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A recoverable ECDSA signature over secp256k1: the two components (r, s) plus the recovery id that selects
 * which of the candidate public keys produced it. Signatures travel as 65 bytes, {@code r || s || v}, with r and s
 * as 32 byte big endian integers and {@code v = 27 + recId}.</p>
 *
 * <p>For any valid (r, s) the pair (r, n - s) is also valid for the same key and message. Only the form with
 * {@code s <= n/2} is accepted by {@link SignatureVerifier}, so signatures cannot be malleated into a second
 * valid encoding.</p>
 */
public class EthSignature {
    /** Number of bytes in the encoded form. */
    public static final int ENCODED_LENGTH = 65;

    /** Value added to the recovery id to form the v byte. */
    public static final int V_OFFSET = 27;

    /** The two components of the signature. */
    public final BigInteger r, s;

    /** Recovery id, 0 or 1. */
    public final int recId;

    /**
     * Constructs a signature with the given components. Does NOT automatically canonicalise the signature.
     */
    public EthSignature(BigInteger r, BigInteger s, int recId) {
        this.r = checkNotNull(r);
        this.s = checkNotNull(s);
        checkArgument(recId == 0 || recId == 1, "Recovery id must be 0 or 1: %s", recId);
        this.recId = recId;
    }

    /** Returns the v byte as it appears on the wire: 27 or 28. */
    public int getV() {
        return V_OFFSET + recId;
    }

    /**
     * Returns true if the S component is "low", that means it is below {@link EthKey#HALF_CURVE_ORDER}.
     */
    public boolean isCanonical() {
        return s.compareTo(EthKey.HALF_CURVE_ORDER) <= 0;
    }

    /**
     * Will automatically adjust the S component to be less than or equal to half the curve order, if necessary.
     * Negating S selects the other candidate point, so the recovery id flips with it.
     */
    public EthSignature toCanonicalised() {
        if (!isCanonical()) {
            return new EthSignature(r, EthKey.CURVE.getN().subtract(s), recId ^ 1);
        } else {
            return this;
        }
    }

    /** Returns the 65 byte {@code r || s || v} encoding. */
    public byte[] encodeToBytes() {
        byte[] bytes = new byte[ENCODED_LENGTH];
        System.arraycopy(Utils.bigIntegerToBytes(r, 32), 0, bytes, 0, 32);
        System.arraycopy(Utils.bigIntegerToBytes(s, 32), 0, bytes, 32, 32);
        bytes[64] = (byte) getV();
        return bytes;
    }

    /**
     * Decodes the 65 byte {@code r || s || v} form. A v of 0 or 1 is accepted as well as 27 or 28, since some
     * signers emit the bare recovery id.
     *
     * @throws SignatureDecodeException if the length is wrong, v is out of range, or r or s are not in [1, n-1]
     */
    public static EthSignature decodeFromBytes(byte[] bytes) throws SignatureDecodeException {
        if (bytes == null || bytes.length != ENCODED_LENGTH)
            throw new SignatureDecodeException("Signature must be " + ENCODED_LENGTH + " bytes, got "
                    + (bytes == null ? "null" : bytes.length));
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(bytes, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
        int v = bytes[64] & 0xFF;
        if (v < V_OFFSET)
            v += V_OFFSET;
        if (v != V_OFFSET && v != V_OFFSET + 1)
            throw new SignatureDecodeException("Invalid v value: " + (bytes[64] & 0xFF));
        BigInteger n = EthKey.CURVE.getN();
        if (r.signum() == 0 || r.compareTo(n) >= 0)
            throw new SignatureDecodeException("r out of range");
        if (s.signum() == 0 || s.compareTo(n) >= 0)
            throw new SignatureDecodeException("s out of range");
        return new EthSignature(r, s, v - V_OFFSET);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EthSignature other = (EthSignature) o;
        return r.equals(other.r) && s.equals(other.s) && recId == other.recId;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(r, s, recId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("r", r.toString(16))
                .add("s", s.toString(16))
                .add("v", getV())
                .toString();
    }
}
