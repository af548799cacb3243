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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.escrowj.core.Amount;
import org.escrowj.core.Bytes32;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An outstanding hash-locked trade, written once when an escrow moves to {@link EscrowState#PUZZLE_POSTED}. The
 * trade amount goes to the payee if someone reveals a preimage whose SHA-256 is the puzzle hash, or back to the
 * escrower once the puzzle timelock passes. Instances are immutable.
 */
public class PuzzleRecord {
    private final Amount tradeAmount;
    private final Bytes32 puzzleHash;
    private final long puzzleTimelock;
    private final Bytes32 authorizingSighash;

    public PuzzleRecord(Amount tradeAmount, Bytes32 puzzleHash, long puzzleTimelock, Bytes32 authorizingSighash) {
        this.tradeAmount = checkNotNull(tradeAmount);
        this.puzzleHash = checkNotNull(puzzleHash);
        checkArgument(puzzleTimelock >= 0, "puzzle timelock must not be negative: %s", puzzleTimelock);
        this.puzzleTimelock = puzzleTimelock;
        this.authorizingSighash = checkNotNull(authorizingSighash);
    }

    /** Value reserved for the payee pending resolution of the puzzle. */
    public Amount getTradeAmount() {
        return tradeAmount;
    }

    /** SHA-256 digest of the secret preimage. */
    public Bytes32 getPuzzleHash() {
        return puzzleHash;
    }

    /** Earliest time (seconds since the epoch) at which the escrower may reclaim the trade amount. */
    public long getPuzzleTimelock() {
        return puzzleTimelock;
    }

    /** The digest both trade keys signed to authorize this puzzle. */
    public Bytes32 getAuthorizingSighash() {
        return authorizingSighash;
    }

    /** Returns true if the preimage hashes to this puzzle. */
    public boolean isSolvedBy(Bytes32 preimage) {
        return Bytes32.sha256(preimage.getBytes()).equals(puzzleHash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PuzzleRecord other = (PuzzleRecord) o;
        return puzzleTimelock == other.puzzleTimelock
                && tradeAmount.equals(other.tradeAmount)
                && puzzleHash.equals(other.puzzleHash)
                && authorizingSighash.equals(other.authorizingSighash);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(tradeAmount, puzzleHash, puzzleTimelock, authorizingSighash);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tradeAmount", tradeAmount)
                .add("puzzleHash", puzzleHash)
                .add("puzzleTimelock", puzzleTimelock)
                .add("sighash", authorizingSighash)
                .toString();
    }
}
