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

import org.escrowj.params.MainNetParams;
import org.escrowj.params.UnitTestParams;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class EscrowParametersTest {

    @Test
    public void fromID() {
        assertSame(MainNetParams.get(), EscrowParameters.fromID(EscrowParameters.ID_MAINNET));
        assertSame(UnitTestParams.get(), EscrowParameters.fromID(EscrowParameters.ID_UNITTESTNET));
        assertNull(EscrowParameters.fromID("org.escrowj.nonexistent"));
    }

    @Test
    public void protocolConstants() {
        for (EscrowParameters params : new EscrowParameters[] {MainNetParams.get(), UnitTestParams.get()}) {
            assertEquals(2 * 24 * 60 * 60, params.getForceRefundGraceSeconds());
            assertEquals("\u0019Ethereum Signed Message:\n", params.getSignedMessagePrefix());
            assertEquals(26, params.getSignedMessagePrefixBytes().length);
        }
    }

    @Test
    public void equalityById() {
        assertEquals(MainNetParams.get(), new MainNetParams());
        assertNotEquals(MainNetParams.get(), UnitTestParams.get());
        assertEquals("org.escrowj.unittest", UnitTestParams.get().toString());
    }
}
