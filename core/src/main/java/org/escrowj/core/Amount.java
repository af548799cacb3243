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

import java.io.Serializable;
import java.math.BigInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Represents an unsigned 256 bit quantity of the escrowed asset, in its smallest unit (wei for ether, the base unit
 * for a token). Arithmetic never wraps: any operation whose result leaves the range [0, 2<sup>256</sup>) throws
 * {@link ArithmeticException}.
 */
public final class Amount implements Comparable<Amount>, Serializable {

    /** Number of bytes an amount takes up in a signed message. */
    public static final int ENCODED_LENGTH = 32;

    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    public static final Amount ZERO = new Amount(BigInteger.ZERO);

    /** The smallest amount that can be escrowed. */
    public static final Amount ONE = new Amount(BigInteger.ONE);

    private final BigInteger value;

    private Amount(final BigInteger value) {
        this.value = value;
    }

    public static Amount valueOf(final long value) {
        return valueOf(BigInteger.valueOf(value));
    }

    public static Amount valueOf(final BigInteger value) {
        checkNotNull(value);
        if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0)
            throw new ArithmeticException("Amount out of range: " + value);
        return value.signum() == 0 ? ZERO : new Amount(value);
    }

    /** Decodes an amount from its 32 byte big endian form. */
    public static Amount fromBytes(byte[] bytes) {
        checkArgument(bytes.length == ENCODED_LENGTH, "Amounts are %s bytes, got %s", ENCODED_LENGTH, bytes.length);
        return valueOf(new BigInteger(1, bytes));
    }

    public BigInteger getValue() {
        return value;
    }

    public Amount add(final Amount other) {
        return valueOf(value.add(other.value));
    }

    public Amount subtract(final Amount other) {
        return valueOf(value.subtract(other.value));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean isGreaterThan(Amount other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    /** Returns the smaller of the two amounts. */
    public static Amount min(Amount a, Amount b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /** Returns the 32 byte big endian encoding used when packing signed messages. */
    public byte[] toBytes() {
        return Utils.bigIntegerToBytes(value, ENCODED_LENGTH);
    }

    @Override
    public String toString() {
        return value.toString();
    }

    @Override
    public boolean equals(final Object o) {
        if (o == this)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        return this.value.equals(((Amount) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(final Amount other) {
        return value.compareTo(other.value);
    }
}
