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
 * Convenience implementation of {@link EscrowEventListener} with empty methods.
 */
public abstract class AbstractEscrowEventListener implements EscrowEventListener {
    @Override
    public void onEscrowCreated(Address handle, EscrowRecord escrow) {
    }

    @Override
    public void onEscrowFunded(Address handle, Amount amount) {
    }

    @Override
    public void onPuzzlePosted(Address handle, PuzzleRecord puzzle) {
    }

    @Override
    public void onPreimageRevealed(Address handle, Bytes32 preimage, Bytes32 puzzleHash) {
    }

    @Override
    public void onEscrowClosed(Address handle, CloseReason reason, EscrowRecord escrow) {
    }

    @Override
    public void onFundsTransferred(Address handle, Party party, Address recipient, Amount amount) {
    }
}
