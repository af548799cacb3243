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

package org.escrowj.escrow.listeners;

import org.escrowj.core.Address;
import org.escrowj.core.Amount;
import org.escrowj.core.Bytes32;
import org.escrowj.escrow.CloseReason;
import org.escrowj.escrow.EscrowRecord;
import org.escrowj.escrow.Party;
import org.escrowj.escrow.PuzzleRecord;

/**
 * <p>Implementors are told about escrow state changes after they have been applied. Off-chain monitors use these to
 * drive the other leg of an atomic swap: most importantly {@link #onPreimageRevealed}, which hands over the secret
 * that unlocks the counterparty chain's hash-locked funds.</p>
 *
 * <p>Notifications are observational. Nothing a listener does, including throwing, affects the escrow. It may be
 * convenient to derive from {@link AbstractEscrowEventListener} instead.</p>
 */
public interface EscrowEventListener {
    /** A new escrow was registered and is waiting for funds. */
    void onEscrowCreated(Address handle, EscrowRecord escrow);

    /** The asset holder was found to hold the full amount and the escrow is now open for trading. */
    void onEscrowFunded(Address handle, Amount amount);

    /** Both trade keys authorized a hash-locked trade. */
    void onPuzzlePosted(Address handle, PuzzleRecord puzzle);

    /** Someone revealed the preimage of the posted puzzle. */
    void onPreimageRevealed(Address handle, Bytes32 preimage, Bytes32 puzzleHash);

    /** The escrow reached its terminal state. */
    void onEscrowClosed(Address handle, CloseReason reason, EscrowRecord escrow);

    /** The asset holder paid out to one of the parties' reserves. */
    void onFundsTransferred(Address handle, Party party, Address recipient, Amount amount);
}
