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

import org.escrowj.core.Address;
import org.escrowj.core.Bytes32;
import org.escrowj.core.Utils;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class SignatureVerifierTest {
    private static final Bytes32 DIGEST = Bytes32.sha256(new byte[] {1, 2, 3});

    @Test
    public void recoversSigner() {
        EthKey key = new EthKey();
        byte[] sig = key.sign(DIGEST).encodeToBytes();
        assertEquals(key.getAddress(), SignatureVerifier.recover(DIGEST, sig));
        assertTrue(SignatureVerifier.verify(DIGEST, sig, key.getAddress()));
        assertEquals(EthKeyTest.ADDRESS, SignatureVerifier.recover(EthKeyTest.SOME_DATA_DIGEST,
                Utils.HEX.decode(EthKeyTest.SOME_DATA_SIG)));
    }

    @Test
    public void wrongSigner() {
        EthKey key = new EthKey();
        Address someoneElse = new EthKey().getAddress();
        assertFalse(SignatureVerifier.verify(DIGEST, key.sign(DIGEST).encodeToBytes(), someoneElse));
    }

    @Test
    public void malformedSignaturesAreRejectedNotThrown() {
        Address anyone = new EthKey().getAddress();
        assertNull(SignatureVerifier.recover(DIGEST, null));
        assertNull(SignatureVerifier.recover(DIGEST, new byte[0]));
        assertNull(SignatureVerifier.recover(DIGEST, new byte[65]));
        assertFalse(SignatureVerifier.verify(DIGEST, null, anyone));
        assertFalse(SignatureVerifier.verify(DIGEST, new byte[66], anyone));
    }

    @Test
    public void highSIsRejected() {
        EthKey key = new EthKey();
        EthSignature low = key.sign(DIGEST);
        EthSignature high = new EthSignature(low.r, EthKey.CURVE.getN().subtract(low.s), low.recId ^ 1);
        assertNull(SignatureVerifier.recover(DIGEST, high.encodeToBytes()));
        assertFalse(SignatureVerifier.verify(DIGEST, high.encodeToBytes(), key.getAddress()));
    }
}
