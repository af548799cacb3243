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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Recovers the address that produced a signature over a 32 byte digest. This is a pure function with no state.</p>
 *
 * <p>A malformed signature (wrong length, bad v byte, r or s out of range, or a high S value) is an ordinary
 * rejection: {@link #recover(Bytes32, byte[])} returns null and never throws. Callers must compare the result with
 * the address of the specific role they expect, a non-null result only says that <i>somebody</i> signed.</p>
 */
public final class SignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

    private SignatureVerifier() {
    }

    /**
     * Returns the address whose key signed the digest, or null if the signature is malformed, not canonical, or
     * does not recover to any key.
     *
     * @param digest the exact digest that was signed
     * @param signature 65 bytes, {@code r || s || v}
     */
    @Nullable
    public static Address recover(Bytes32 digest, @Nullable byte[] signature) {
        checkNotNull(digest);
        EthSignature sig;
        try {
            sig = EthSignature.decodeFromBytes(signature);
        } catch (SignatureDecodeException e) {
            log.debug("Rejecting malformed signature: {}", e.getMessage());
            return null;
        }
        if (!sig.isCanonical()) {
            log.debug("Rejecting signature with high S value");
            return null;
        }
        return EthKey.recoverAddress(digest, sig);
    }

    /**
     * Returns true only if the signature is well formed and recovers to exactly the expected address.
     */
    public static boolean verify(Bytes32 digest, @Nullable byte[] signature, Address expectedSigner) {
        checkNotNull(expectedSigner);
        Address recovered = recover(digest, signature);
        return recovered != null && recovered.equals(expectedSigner);
    }
}
