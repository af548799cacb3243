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
import org.escrowj.core.EscrowParameters;
import org.escrowj.crypto.EthKey;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Produces the signatures a counterparty hands over during a trade: cashouts and puzzles signed with a trade key,
 * refunds signed with the escrower's refund key. Each method returns the 65 byte encoding that the
 * {@link EscrowRegistry} entry points accept.
 */
public class EscrowSigner {
    private final EscrowParameters params;
    private final EthKey key;

    public EscrowSigner(EscrowParameters params, EthKey key) {
        this.params = checkNotNull(params);
        this.key = checkNotNull(key);
        checkArgument(key.hasPrivKey(), "Signing needs a private key");
    }

    /** The address signatures from this signer recover to. */
    public Address getAddress() {
        return key.getAddress();
    }

    public byte[] signCashout(Address handle, Amount amountTraded) {
        return sign(EscrowMessages.cashoutDigest(params, handle, amountTraded));
    }

    public byte[] signRefund(Address handle, Amount amountTraded) {
        return sign(EscrowMessages.refundDigest(params, handle, amountTraded));
    }

    public byte[] signPuzzle(Address handle, Amount prevAmountTraded, Amount tradeAmount, Bytes32 puzzleHash,
                             long puzzleTimelock) {
        return sign(EscrowMessages.puzzleDigest(params, handle, prevAmountTraded, tradeAmount, puzzleHash,
                puzzleTimelock));
    }

    private byte[] sign(Bytes32 digest) {
        return key.sign(digest).encodeToBytes();
    }
}
