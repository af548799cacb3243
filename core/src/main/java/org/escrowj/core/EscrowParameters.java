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

import com.google.common.base.Objects;

import org.escrowj.params.MainNetParams;
import org.escrowj.params.UnitTestParams;

import java.nio.charset.StandardCharsets;

/**
 * <p>EscrowParameters contains the protocol constants an {@link org.escrowj.escrow.EscrowRegistry} enforces: the
 * grace period before a signature-free forced refund becomes possible and the prefix that turns a packed message
 * into a signable digest.</p>
 *
 * <p>This is an abstract class, concrete instantiations can be found in the params package. There are two:
 * one for production use ({@link MainNetParams}) and one that is intended for unit testing
 * ({@link UnitTestParams}).</p>
 */
public abstract class EscrowParameters {
    /** The string returned by getId() for the production parameters. */
    public static final String ID_MAINNET = "org.escrowj.production";
    /** Unit test parameters. */
    public static final String ID_UNITTESTNET = "org.escrowj.unittest";

    /** The grace period after an escrow's timelock at which a forced refund may be made: two days. */
    public static final long FORCE_REFUND_GRACE_SECONDS = 2 * 24 * 60 * 60;

    /** Prefix prepended (with the decimal message length) to every message before it is hashed and signed. */
    public static final String SIGNED_MESSAGE_PREFIX = "\u0019Ethereum Signed Message:\n";

    protected String id;
    protected long forceRefundGraceSeconds;
    protected String signedMessagePrefix;

    protected EscrowParameters() {
        forceRefundGraceSeconds = FORCE_REFUND_GRACE_SECONDS;
        signedMessagePrefix = SIGNED_MESSAGE_PREFIX;
    }

    /** A Java package style string acting as unique ID for these parameters */
    public String getId() {
        return id;
    }

    /**
     * Returns the number of seconds that must pass after an escrow's timelock before
     * {@link org.escrowj.escrow.EscrowRegistry#forceRefund} is permitted.
     */
    public long getForceRefundGraceSeconds() {
        return forceRefundGraceSeconds;
    }

    /** Returns the prefix that signers prepend to messages, before the decimal length of the message. */
    public String getSignedMessagePrefix() {
        return signedMessagePrefix;
    }

    /** Returns the signed message prefix as bytes. */
    public byte[] getSignedMessagePrefixBytes() {
        return signedMessagePrefix.getBytes(StandardCharsets.UTF_8);
    }

    /** Returns the parameters object for the given ID, or null if it's not recognized. */
    public static EscrowParameters fromID(String id) {
        if (id.equals(ID_MAINNET)) {
            return MainNetParams.get();
        } else if (id.equals(ID_UNITTESTNET)) {
            return UnitTestParams.get();
        } else {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getId().equals(((EscrowParameters) o).getId());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }

    @Override
    public String toString() {
        return getId();
    }
}
