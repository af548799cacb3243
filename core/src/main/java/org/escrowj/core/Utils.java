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

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import org.bouncycastle.crypto.digests.KeccakDigest;

import java.math.BigInteger;
import java.util.Date;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A collection of various utility methods that are helpful for working with escrow messages: hex encoding, the two
 * hash functions the protocol uses and a clock that can be mocked by unit tests.
 */
public class Utils {

    /** Hex encoding used throughout the framework. Use with HEX.encode(byte[]) or HEX.decode(CharSequence). */
    public static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    // Mocked clock, null when the real wall clock is in use.
    private static volatile Date mockTime;

    /**
     * Calculates the Keccak-256 hash of the given bytes. This is the pre-standard Keccak used by Ethereum, not the
     * padded FIPS-202 SHA3-256.
     */
    public static byte[] keccak256(byte[] input) {
        return keccak256(input, 0, input.length);
    }

    /** Calculates the Keccak-256 hash of the given byte range. */
    public static byte[] keccak256(byte[] input, int offset, int length) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, offset, length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    /** Calculates the SHA-256 hash of the given bytes. */
    public static byte[] sha256(byte[] input) {
        return Hashing.sha256().hashBytes(input).asBytes();
    }

    /**
     * <p>The regular {@link java.math.BigInteger#toByteArray()} includes the sign bit of the number and
     * might result in an extra byte addition. This method removes this extra byte and pads the result with
     * leading zeros up to the requested length, which is how unsigned integers are packed into signed messages.</p>
     * @param b the integer to format into a byte array
     * @param numBytes the desired size of the resulting byte array
     * @return numBytes byte long array, big endian.
     */
    public static byte[] bigIntegerToBytes(BigInteger b, int numBytes) {
        checkArgument(b.signum() >= 0, "b must be positive or zero");
        checkArgument(numBytes > 0, "numBytes must be positive");
        byte[] src = b.toByteArray();
        byte[] dest = new byte[numBytes];
        boolean isFirstByteOnlyForSign = src[0] == 0;
        int length = isFirstByteOnlyForSign ? src.length - 1 : src.length;
        checkArgument(length <= numBytes, "The given number does not fit in " + numBytes);
        int srcPos = isFirstByteOnlyForSign ? 1 : 0;
        int destPos = numBytes - length;
        System.arraycopy(src, srcPos, dest, destPos, length);
        return dest;
    }

    /** Encodes a non-negative long as a 32 byte big endian word. */
    public static byte[] uint256ToBytes(long value) {
        checkArgument(value >= 0, "value must be positive or zero: %s", value);
        return bigIntegerToBytes(BigInteger.valueOf(value), 32);
    }

    /**
     * Advances (or rewinds) the mock clock by the given number of seconds.
     */
    public static Date rollMockClock(int seconds) {
        return rollMockClockMillis(seconds * 1000L);
    }

    /**
     * Advances (or rewinds) the mock clock by the given number of milliseconds.
     */
    public static Date rollMockClockMillis(long millis) {
        if (mockTime == null)
            throw new IllegalStateException("You need to use setMockClock() first.");
        mockTime = new Date(mockTime.getTime() + millis);
        return mockTime;
    }

    /**
     * Sets the mock clock to the current time.
     */
    public static void setMockClock() {
        mockTime = new Date();
    }

    /**
     * Sets the mock clock to the given time (in seconds).
     */
    public static void setMockClock(long mockClockSeconds) {
        mockTime = new Date(mockClockSeconds * 1000);
    }

    /**
     * Clears the mock clock
     */
    public static void resetMocking() {
        mockTime = null;
    }

    /**
     * Returns the current time, or a mocked out equivalent.
     */
    public static Date now() {
        return mockTime != null ? mockTime : new Date();
    }

    /** Returns the current time in milliseconds since the epoch, or a mocked out equivalent. */
    public static long currentTimeMillis() {
        return mockTime != null ? mockTime.getTime() : System.currentTimeMillis();
    }

    /** Returns the current time in seconds since the epoch, or a mocked out equivalent. */
    public static long currentTimeSeconds() {
        return currentTimeMillis() / 1000;
    }
}
