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

import com.google.common.primitives.UnsignedBytes;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>A 20 byte account identifier: the last 20 bytes of the Keccak-256 hash of an uncompressed secp256k1 public
 * key. Addresses name the reserve accounts that settled funds are paid to, the keys that authorize escrow
 * transitions, and the escrows themselves (an escrow's handle is the address its asset holder lives at).</p>
 *
 * <p>The text form is the mixed-case checksummed encoding of EIP-55. Parsing accepts any case, and rejects mixed
 * case input whose checksum does not match.</p>
 */
public class Address implements Serializable, Comparable<Address> {
    public static final int LENGTH = 20;

    private final byte[] bytes;

    private Address(byte[] bytes) {
        checkArgument(bytes.length == LENGTH, "Addresses are %s bytes long, got %s", LENGTH, bytes.length);
        this.bytes = bytes;
    }

    /** Creates an address from its raw 20 bytes. The array is copied. */
    public static Address wrap(byte[] bytes) {
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    /** Takes the last 20 bytes of the given digest, which is how addresses are derived from keys and handles. */
    public static Address fromDigest(Bytes32 digest) {
        byte[] hash = digest.getBytes();
        return new Address(Arrays.copyOfRange(hash, Bytes32.LENGTH - LENGTH, Bytes32.LENGTH));
    }

    /**
     * Parses a 40 digit hex address, with or without the 0x prefix.
     *
     * @throws IllegalArgumentException if the string is malformed or has a bad mixed-case checksum
     */
    public static Address fromHex(String hex) {
        String digits = Bytes32.stripHexPrefix(hex);
        checkArgument(digits.length() == LENGTH * 2, "Bad address length: %s", hex);
        Address address = new Address(Utils.HEX.decode(digits.toLowerCase(Locale.US)));
        boolean mixedCase = !digits.equals(digits.toLowerCase(Locale.US)) && !digits.equals(digits.toUpperCase(Locale.US));
        if (mixedCase)
            checkArgument(address.toChecksummedHex().substring(2).equals(digits), "Address checksum mismatch: %s", hex);
        return address;
    }

    /** Returns a copy of the raw bytes. */
    public byte[] getBytes() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    /** Returns the EIP-55 checksummed representation, 0x prefixed. */
    public String toChecksummedHex() {
        String lower = Utils.HEX.encode(bytes);
        String hashHex = Utils.HEX.encode(Utils.keccak256(lower.getBytes(StandardCharsets.US_ASCII)));
        StringBuilder sb = new StringBuilder(2 + lower.length());
        sb.append("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetter(c) && Character.digit(hashHex.charAt(i), 16) >= 8)
                sb.append(Character.toUpperCase(c));
            else
                sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Address) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toChecksummedHex();
    }

    @Override
    public int compareTo(Address other) {
        return UnsignedBytes.lexicographicalComparator().compare(bytes, other.bytes);
    }
}
