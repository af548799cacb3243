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

package org.escrowj.core;

import com.google.common.primitives.Ints;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A 32 byte value: a SHA-256 or Keccak-256 digest, a hash puzzle or its preimage. Instances are immutable and
 * compare by content. The bytes are kept in the order they appear on the wire (big endian).
 */
public class Bytes32 implements Serializable, Comparable<Bytes32> {
    public static final int LENGTH = 32; // bytes
    public static final Bytes32 ZERO_HASH = wrap(new byte[LENGTH]);

    private final byte[] bytes;

    private Bytes32(byte[] rawBytes) {
        checkArgument(rawBytes.length == LENGTH, "Expected %s bytes but got %s", LENGTH, rawBytes.length);
        this.bytes = rawBytes;
    }

    /**
     * Creates a new instance that wraps the given bytes. The array is copied so later changes to it are not seen.
     *
     * @param rawBytes the raw bytes to wrap
     * @return a new instance
     */
    public static Bytes32 wrap(byte[] rawBytes) {
        return new Bytes32(Arrays.copyOf(rawBytes, rawBytes.length));
    }

    /**
     * Creates a new instance from the given hex string, with or without a leading {@code 0x}.
     *
     * @param hexString a hex string of 64 digits
     * @return a new instance
     * @throws IllegalArgumentException if the given string is not a valid hex string, or if it does not represent
     * exactly 32 bytes
     */
    public static Bytes32 wrap(String hexString) {
        return new Bytes32(Utils.HEX.decode(stripHexPrefix(hexString).toLowerCase()));
    }

    /** Returns the SHA-256 hash of the given bytes. */
    public static Bytes32 sha256(byte[] contents) {
        return new Bytes32(Utils.sha256(contents));
    }

    /** Returns the Keccak-256 hash of the given bytes. */
    public static Bytes32 keccak256(byte[] contents) {
        return new Bytes32(Utils.keccak256(contents));
    }

    static String stripHexPrefix(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    /** Returns the bytes interpreted as a positive integer. */
    public BigInteger toBigInteger() {
        return new BigInteger(1, bytes);
    }

    /** Returns a copy of the internal byte array. */
    public byte[] getBytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Bytes32) o).bytes);
    }

    /**
     * Returns the last four bytes of the value interpreted as an int. Digests are uniformly distributed, so that
     * is as good a hash code as any other.
     */
    @Override
    public int hashCode() {
        return Ints.fromBytes(bytes[LENGTH - 4], bytes[LENGTH - 3], bytes[LENGTH - 2], bytes[LENGTH - 1]);
    }

    /** Returns the value as 0x-prefixed lower case hex, the form used in signed message tooling. */
    @Override
    public String toString() {
        return "0x" + Utils.HEX.encode(bytes);
    }

    @Override
    public int compareTo(final Bytes32 other) {
        for (int i = 0; i < LENGTH; i++) {
            final int thisByte = this.bytes[i] & 0xff;
            final int otherByte = other.bytes[i] & 0xff;
            if (thisByte > otherByte)
                return 1;
            if (thisByte < otherByte)
                return -1;
        }
        return 0;
    }
}
