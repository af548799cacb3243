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

package org.escrowj.escrow;

import org.escrowj.core.Address;
import org.escrowj.core.Amount;
import org.escrowj.core.Bytes32;
import org.escrowj.core.Utils;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class EscrowTermsTest {
    private static final Address A = Address.fromHex("0x1111111111111111111111111111111111111111");
    private static final Address B = Address.fromHex("0x2222222222222222222222222222222222222222");
    private static final Address C = Address.fromHex("0x3333333333333333333333333333333333333333");
    private static final Address D = Address.fromHex("0x4444444444444444444444444444444444444444");
    private static final Address E = Address.fromHex("0x5555555555555555555555555555555555555555");

    private static EscrowTerms.Builder builder() {
        return EscrowTerms.builder()
                .amount(Amount.valueOf(1000))
                .timelock(1500000000L)
                .escrowerReserve(A)
                .escrowerTrade(B)
                .escrowerRefund(C)
                .payeeReserve(D)
                .payeeTrade(E);
    }

    @Test
    public void packedLayout() {
        byte[] packed = builder().build().encodePacked();
        assertEquals(164, packed.length);
        assertEquals(Amount.valueOf(1000), Amount.fromBytes(Arrays.copyOfRange(packed, 0, 32)));
        assertArrayEquals(Utils.uint256ToBytes(1500000000L), Arrays.copyOfRange(packed, 32, 64));
        assertArrayEquals(A.getBytes(), Arrays.copyOfRange(packed, 64, 84));
        assertArrayEquals(B.getBytes(), Arrays.copyOfRange(packed, 84, 104));
        assertArrayEquals(C.getBytes(), Arrays.copyOfRange(packed, 104, 124));
        assertArrayEquals(D.getBytes(), Arrays.copyOfRange(packed, 124, 144));
        assertArrayEquals(E.getBytes(), Arrays.copyOfRange(packed, 144, 164));
        assertEquals(Bytes32.keccak256(packed), builder().build().getParamsHash());
    }

    @Test
    public void equality() {
        assertEquals(builder().build(), builder().build());
        assertEquals(builder().build().hashCode(), builder().build().hashCode());
        assertNotEquals(builder().build(), builder().timelock(1).build());
        assertNotEquals(builder().build().getParamsHash(), builder().payeeTrade(A).build().getParamsHash());
    }

    @Test(expected = NullPointerException.class)
    public void missingAddress() {
        builder().payeeReserve(null).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTimelock() {
        builder().timelock(-1).build();
    }
}
