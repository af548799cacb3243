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

import org.junit.Test;

import java.math.BigInteger;

import static org.escrowj.core.Amount.*;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AmountTest {

    @Test
    public void testValueOf() {
        assertSame(ZERO, valueOf(0));
        assertEquals(ONE, valueOf(1));
        assertEquals(BigInteger.valueOf(1000), valueOf(1000).getValue());
        assertEquals(MAX_VALUE, valueOf(MAX_VALUE).getValue());

        try {
            valueOf(-1);
            fail();
        } catch (ArithmeticException e) {}
        try {
            valueOf(MAX_VALUE.add(BigInteger.ONE));
            fail();
        } catch (ArithmeticException e) {}
    }

    @Test
    public void testArithmetic() {
        assertEquals(valueOf(1000), valueOf(600).add(valueOf(400)));
        assertEquals(valueOf(600), valueOf(1000).subtract(valueOf(400)));
        assertEquals(ZERO, valueOf(400).subtract(valueOf(400)));
        assertEquals(valueOf(3), min(valueOf(3), valueOf(5)));
        assertEquals(valueOf(3), min(valueOf(5), valueOf(3)));
    }

    @Test(expected = ArithmeticException.class)
    public void testSubtractBelowZero() {
        valueOf(400).subtract(valueOf(401));
    }

    @Test(expected = ArithmeticException.class)
    public void testAddOverflow() {
        valueOf(MAX_VALUE).add(ONE);
    }

    @Test
    public void testComparisons() {
        assertTrue(ZERO.isZero());
        assertFalse(ZERO.isPositive());
        assertTrue(ONE.isPositive());
        assertTrue(valueOf(2).isGreaterThan(ONE));
        assertFalse(ONE.isGreaterThan(ONE));
        assertTrue(ONE.isLessThan(valueOf(2)));
        assertFalse(ONE.isLessThan(ONE));
        assertEquals(0, valueOf(7).compareTo(valueOf(7)));
    }

    @Test
    public void testEncoding() {
        byte[] encoded = valueOf(0x0102).toBytes();
        assertEquals(ENCODED_LENGTH, encoded.length);
        assertEquals(0x01, encoded[30]);
        assertEquals(0x02, encoded[31]);
        assertEquals(valueOf(0x0102), fromBytes(encoded));

        byte[] max = valueOf(MAX_VALUE).toBytes();
        for (byte b : max)
            assertEquals((byte) 0xff, b);
        assertArrayEquals(new byte[32], ZERO.toBytes());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromBytesWrongLength() {
        fromBytes(new byte[31]);
    }

    @Test
    public void testToString() {
        assertEquals("0", ZERO.toString());
        assertEquals("1000", valueOf(1000).toString());
    }
}
