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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class AddressTest {
    // From EIP-55.
    private static final String[] CHECKSUMMED = {
            "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed",
            "0xfB6916095ca1df60bB79Ce92cE3Ea74c37c5d359",
            "0xdbF03B407c01E7cD3CBea99509d93f8DDDC8C6FB",
            "0xD1220A0cf47c7B9Be7A2E6BA89F429762e7b9aDb",
    };

    @Test
    public void checksummedRoundTrip() {
        for (String hex : CHECKSUMMED) {
            Address address = Address.fromHex(hex);
            assertEquals(hex, address.toChecksummedHex());
            assertEquals(hex, address.toString());
        }
    }

    @Test
    public void singleCaseIsAccepted() {
        String hex = CHECKSUMMED[0];
        assertEquals(Address.fromHex(hex), Address.fromHex(hex.toLowerCase()));
        assertEquals(Address.fromHex(hex), Address.fromHex("0x" + hex.substring(2).toUpperCase()));
        assertEquals(Address.fromHex(hex), Address.fromHex(hex.substring(2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badChecksum() {
        // Flip the case of one letter.
        Address.fromHex("0x5AAeb6053F3E94C9b9A09f33669435E7Ef1BeAed");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badLength() {
        Address.fromHex("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeA");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badWrapLength() {
        Address.wrap(new byte[19]);
    }

    @Test
    public void fromDigestTakesLastTwentyBytes() {
        Bytes32 digest = Bytes32.wrap("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");
        assertEquals(Address.fromHex("0x0c0d0e0f101112131415161718191a1b1c1d1e1f"), Address.fromDigest(digest));
    }

    @Test
    public void equalityAndOrdering() {
        Address a = Address.fromHex("0x0000000000000000000000000000000000000001");
        Address b = Address.fromHex("0x00000000000000000000000000000000000000ff");
        assertEquals(a, Address.wrap(a.getBytes()));
        assertEquals(a.hashCode(), Address.wrap(a.getBytes()).hashCode());
        assertNotEquals(a, b);
        assertTrue(a.compareTo(b) < 0);

        byte[] bytes = a.getBytes();
        bytes[0] = 1;
        assertEquals(Address.fromHex("0x0000000000000000000000000000000000000001"), a);
    }
}
