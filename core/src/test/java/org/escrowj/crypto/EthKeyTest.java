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
import org.escrowj.escrow.EscrowMessages;
import org.escrowj.params.UnitTestParams;
import org.junit.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EthKeyTest {
    // Test vectors from the web3.js account documentation.
    static final String PRIV_KEY = "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    static final Address ADDRESS = Address.fromHex("0x2c7536E3605D9C16a7a3D7b1898e529396a65c23");
    static final Bytes32 SOME_DATA_DIGEST =
            Bytes32.wrap("0x1da44b586eb0729ff70a73c326926f6ed5a25f5b056e7f47fbc6e58d86871655");
    static final String SOME_DATA_SIG = "b91467e570a6466aa9e9876cbcd013baba02900b8979d43fe208a4a4f339f5fd"
            + "6007e74cd82e037b800186422fc2da167c747ef045e5d18a5f5d4300f8e1a029" + "1c";

    @Test
    public void addressFromPrivateKey() {
        EthKey key = EthKey.fromPrivate(Utils.HEX.decode(PRIV_KEY));
        assertEquals(ADDRESS, key.getAddress());
        assertTrue(key.hasPrivKey());
        assertEquals(new BigInteger(PRIV_KEY, 16), key.getPrivKey());
        assertEquals(65, key.getPubKey().length);
        assertEquals(0x04, key.getPubKey()[0]);
    }

    @Test
    public void signedMessageDigest() {
        byte[] message = "Some data".getBytes(StandardCharsets.UTF_8);
        assertEquals(SOME_DATA_DIGEST, EscrowMessages.toSignableDigest(UnitTestParams.get(), message));
    }

    @Test
    public void recoverKnownSignature() throws Exception {
        EthSignature sig = EthSignature.decodeFromBytes(Utils.HEX.decode(SOME_DATA_SIG));
        assertEquals(28, sig.getV());
        assertTrue(sig.isCanonical());
        assertEquals(ADDRESS, EthKey.recoverAddress(SOME_DATA_DIGEST, sig));
    }

    @Test
    public void signAndRecover() {
        EthKey key = EthKey.fromPrivate(Utils.HEX.decode(PRIV_KEY));
        EthSignature sig = key.sign(SOME_DATA_DIGEST);
        assertTrue(sig.isCanonical());
        assertTrue(key.verify(SOME_DATA_DIGEST, sig));
        assertEquals(ADDRESS, EthKey.recoverAddress(SOME_DATA_DIGEST, sig));
        // RFC 6979 nonces make signing deterministic.
        assertEquals(sig, key.sign(SOME_DATA_DIGEST));
    }

    @Test
    public void randomKeys() {
        for (int i = 0; i < 10; i++) {
            EthKey key = new EthKey();
            Bytes32 digest = Bytes32.sha256(new byte[] {(byte) i});
            EthSignature sig = key.sign(digest);
            assertEquals(key.getAddress(), EthKey.recoverAddress(digest, sig));
            assertFalse(key.verify(Bytes32.sha256(new byte[] {(byte) (i + 1)}), sig));
        }
    }

    @Test
    public void recoveryOfOtherDigestGivesOtherAddress() {
        EthKey key = new EthKey();
        EthSignature sig = key.sign(SOME_DATA_DIGEST);
        Address recovered = EthKey.recoverAddress(Bytes32.ZERO_HASH, sig);
        assertNotEquals(key.getAddress(), recovered);
    }

    @Test
    public void publicOnly() {
        EthKey key = new EthKey();
        EthKey pubOnly = EthKey.fromPublicOnly(key.getPubKey());
        assertFalse(pubOnly.hasPrivKey());
        assertEquals(key.getAddress(), pubOnly.getAddress());
        assertEquals(key, pubOnly);
        assertEquals(key.hashCode(), pubOnly.hashCode());
        assertTrue(pubOnly.verify(SOME_DATA_DIGEST, key.sign(SOME_DATA_DIGEST)));
        assertArrayEquals(key.getPubKey(), pubOnly.getPubKey());
    }

    @Test(expected = IllegalStateException.class)
    public void publicOnlyCannotSign() {
        EthKey.fromPublicOnly(new EthKey().getPubKey()).sign(SOME_DATA_DIGEST);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroPrivateKey() {
        EthKey.fromPrivate(BigInteger.ZERO);
    }

    @Test(expected = IllegalArgumentException.class)
    public void privateKeyAboveOrder() {
        EthKey.fromPrivate(EthKey.CURVE.getN());
    }

    @Test
    public void recoverFromBadComponents() {
        BigInteger n = EthKey.CURVE.getN();
        assertNull(EthKey.recoverFromSignature(0, BigInteger.ZERO, BigInteger.ONE, SOME_DATA_DIGEST));
        assertNull(EthKey.recoverFromSignature(0, BigInteger.ONE, n, SOME_DATA_DIGEST));
    }
}
