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

import com.google.common.collect.ImmutableMap;
import com.google.common.math.LongMath;
import net.jcip.annotations.GuardedBy;
import org.escrowj.core.Address;
import org.escrowj.core.Amount;
import org.escrowj.core.Bytes32;
import org.escrowj.core.EscrowParameters;
import org.escrowj.core.Utils;
import org.escrowj.crypto.SignatureVerifier;
import org.escrowj.escrow.listeners.EscrowEventListener;
import org.escrowj.utils.ListenerRegistration;
import org.escrowj.utils.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>The registry is the one place escrows change state. It holds every escrow's terms, state and internal balances,
 * checks the signatures and timelocks that authorize each transition, and decides who is owed what. Everyone else
 * refers to an escrow by its handle, the address of the {@link AssetHolder} that custodies its value.</p>
 *
 * <p>An escrow is registered by the factory (see {@link #newRegistrar()}), opens once its asset holder holds the full
 * amount, and is then closed in one of five ways:</p>
 *
 * <ul>
 *     <li>{@link #cashout}: both trade keys sign the final split.</li>
 *     <li>{@link #refund}: after the escrow timelock the escrower's refund key alone signs the final split.</li>
 *     <li>{@link #forceRefund}: two days after the escrow timelock anyone may return everything to the escrower.</li>
 *     <li>{@link #postPuzzle} then {@link #solvePuzzle}: both trade keys settle the trades agreed so far and lock one
 *     more trade behind a SHA-256 hash, which the payee collects by revealing the preimage.</li>
 *     <li>{@link #postPuzzle} then {@link #refundPuzzle}: the puzzle timelock passes unsolved and the locked trade
 *     goes back to the escrower.</li>
 * </ul>
 *
 * <p>Cashout, refund and force refund pay both parties out immediately, as a best effort. A payout the asset holder
 * refuses is not an error: the amount stays credited to the party and can be collected later with
 * {@link #withdraw}. The puzzle paths only credit balances; the parties always collect with {@link #withdraw}.
 * Over-funding that could not be returned at open is collected with {@link #withdrawExcess}.</p>
 *
 * <p>Every guard is checked before anything changes, so a rejected call, reported as an {@link EscrowException},
 * leaves the escrow exactly as it was. The invariant maintained for every escrow is that the two internal balances
 * plus whatever has been paid out never exceed the escrow amount, and equal it once the escrow is closed.</p>
 *
 * <p>All methods are thread safe. Calls are serialized on a single lock, so each one observes the effects of every
 * call that returned before it.</p>
 */
public class EscrowRegistry {
    private static final Logger log = LoggerFactory.getLogger(EscrowRegistry.class);

    protected final ReentrantLock lock = Threading.lock("escrow-registry");

    private final EscrowParameters params;

    @GuardedBy("lock") private final Map<Address, EscrowRecord> escrows = new HashMap<>();
    @GuardedBy("lock") private final Map<Address, AssetHolder> assetHolders = new HashMap<>();
    // At most one entry per escrow, written by postPuzzle.
    @GuardedBy("lock") private final Map<Address, PuzzleRecord> puzzles = new HashMap<>();
    @GuardedBy("lock") private boolean registrarIssued;

    // Amounts paid out through the asset holder, per escrow and party. Together with the internal balances this
    // accounts for the whole escrow amount.
    @GuardedBy("lock") private final Map<Address, EnumMap<Party, Amount>> paidOut = new HashMap<>();

    private final CopyOnWriteArrayList<ListenerRegistration<EscrowEventListener>> eventListeners
            = new CopyOnWriteArrayList<>();

    public EscrowRegistry(EscrowParameters params) {
        this.params = checkNotNull(params);
    }

    public EscrowParameters getParams() {
        return params;
    }

    /**
     * Returns the capability to register escrows. There is exactly one per registry, handed to whoever asks first,
     * which is meant to be the {@link EscrowFactory}.
     *
     * @throws IllegalStateException if the registrar was already issued
     */
    public Registrar newRegistrar() {
        lock.lock();
        try {
            checkState(!registrarIssued, "This registry already has a registrar");
            registrarIssued = true;
            return new Registrar();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The right to create escrows in one particular registry. Only code holding this object can register, which
     * is how the registry tells the factory apart from everybody else.
     */
    public final class Registrar {
        private Registrar() {
        }

        /**
         * Registers a new escrow in state {@link EscrowState#UNFUNDED} with both internal balances at zero.
         *
         * @param handle the escrow's handle
         * @param terms the agreed terms
         * @param assetHolder the asset holder living at the handle
         * @throws EscrowException.InvalidParameters if the amount is zero, the handle is already registered, or the
         * asset holder is not at the handle
         */
        public void register(Address handle, EscrowTerms terms, AssetHolder assetHolder) {
            create(handle, terms, assetHolder);
        }

        /** Returns the registry this registrar registers into. */
        public EscrowRegistry getRegistry() {
            return EscrowRegistry.this;
        }
    }

    private void create(Address handle, EscrowTerms terms, AssetHolder assetHolder) {
        checkNotNull(handle);
        checkNotNull(terms);
        checkNotNull(assetHolder);
        EscrowRecord snapshot;
        lock.lock();
        try {
            if (!terms.getAmount().isPositive())
                throw new EscrowException.InvalidParameters("Escrow amount must be positive");
            if (escrows.containsKey(handle))
                throw new EscrowException.InvalidParameters("Escrow already exists: " + handle);
            if (!handle.equals(assetHolder.getAddress()))
                throw new EscrowException.InvalidParameters("Asset holder at " + assetHolder.getAddress()
                        + " does not match escrow handle " + handle);
            EscrowRecord escrow = new EscrowRecord(terms);
            escrows.put(handle, escrow);
            assetHolders.put(handle, assetHolder);
            paidOut.put(handle, new EnumMap<Party, Amount>(Party.class));
            snapshot = escrow.copy();
            log.info("Registered escrow {} for {} with timelock {}", handle, terms.getAmount(), terms.getTimelock());
        } finally {
            lock.unlock();
        }
        queueOnEscrowCreated(handle, snapshot);
    }

    /**
     * Opens an escrow whose asset holder holds at least the escrow amount. Anything above the amount is sent back
     * to the escrower's reserve straight away and never becomes part of the escrow.
     *
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#UNFUNDED} or is not yet funded
     */
    public void open(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.UNFUNDED);
            AssetHolder holder = assetHolders.get(handle);
            Amount balance = holder.balance();
            if (balance.isLessThan(escrow.getAmount()))
                throw new EscrowException.InvalidState("Escrow not funded: holds " + balance + " of "
                        + escrow.getAmount());
            escrow.transition(EscrowState.OPEN);
            log.info("Escrow {} funded and open", handle);
            queueOnEscrowFunded(handle, escrow.getAmount());

            Amount excess = balance.subtract(escrow.getAmount());
            if (excess.isPositive()) {
                Address reserve = escrow.getEscrowerReserve();
                if (trySend(handle, holder, reserve, excess)) {
                    queueOnFundsTransferred(handle, Party.ESCROWER, reserve, excess);
                } else {
                    escrow.setUnreturnedExcess(excess);
                    log.warn("Could not return excess funding of {} for escrow {} to {}", excess, handle, reserve);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes an open escrow with the split both trade keys agreed to: the payee gets amountTraded, the escrower the
     * rest. Both shares are paid out immediately where the asset holder allows.
     *
     * @param amountTraded the payee's share
     * @param escrowerSig the escrower trade key's signature over the cashout message
     * @param payeeSig the payee trade key's signature over the cashout message
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#OPEN}
     * @throws EscrowException.InvalidParameters if amountTraded exceeds the escrow amount
     * @throws EscrowException.InvalidSignature if either signature is not from the expected trade key
     */
    public void cashout(Address handle, Amount amountTraded, byte[] escrowerSig, byte[] payeeSig) {
        checkNotNull(amountTraded);
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.OPEN);
            checkTradedAmount(escrow, amountTraded);
            Bytes32 digest = EscrowMessages.cashoutDigest(params, handle, amountTraded);
            if (!SignatureVerifier.verify(digest, escrowerSig, escrow.getEscrowerTrade()))
                throw new EscrowException.InvalidSignature("Invalid escrower cashout sig");
            if (!SignatureVerifier.verify(digest, payeeSig, escrow.getPayeeTrade()))
                throw new EscrowException.InvalidSignature("Invalid payee cashout sig");

            closeWithSplitLocked(handle, escrow, amountTraded, CloseReason.CASHOUT);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes an open escrow once its timelock has passed, with the split the escrower's refund key signed. This does
     * not need the payee: the split is whatever was last agreed, and the payee already holds the escrower's
     * signature for it.
     *
     * @param amountTraded the payee's share
     * @param escrowerRefundSig the escrower refund key's signature over the refund message
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#OPEN}
     * @throws EscrowException.TimelockNotReached if the escrow timelock has not passed
     * @throws EscrowException.InvalidParameters if amountTraded exceeds the escrow amount
     * @throws EscrowException.InvalidSignature if the signature is not from the refund key
     */
    public void refund(Address handle, Amount amountTraded, byte[] escrowerRefundSig) {
        checkNotNull(amountTraded);
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.OPEN);
            if (Utils.currentTimeSeconds() < escrow.getTimelock())
                throw new EscrowException.TimelockNotReached("Escrow timelock not reached");
            checkTradedAmount(escrow, amountTraded);
            Bytes32 digest = EscrowMessages.refundDigest(params, handle, amountTraded);
            if (!SignatureVerifier.verify(digest, escrowerRefundSig, escrow.getEscrowerRefund()))
                throw new EscrowException.InvalidSignature("Invalid escrower refund sig");

            closeWithSplitLocked(handle, escrow, amountTraded, CloseReason.REFUND);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last resort for an open escrow nobody can sign for any more: once the escrow timelock plus the force refund
     * grace period has passed, anyone may close it and send everything the asset holder has to the escrower.
     *
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#OPEN}
     * @throws EscrowException.TimelockNotReached if the grace period has not passed
     */
    public void forceRefund(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.OPEN);
            if (Utils.currentTimeSeconds() < getForceRefundTimelock(escrow))
                throw new EscrowException.TimelockNotReached("Escrow force refund timelock not reached");

            escrow.setBalance(Party.ESCROWER, escrow.getAmount());
            escrow.setBalance(Party.PAYEE, Amount.ZERO);
            escrow.transition(EscrowState.CLOSED);
            log.info("Escrow {} force refunded", handle);
            queueOnEscrowClosed(handle, CloseReason.FORCE_REFUND, escrow.copy());

            // The whole holder balance goes, including any excess funding that could not be returned at open.
            AssetHolder holder = assetHolders.get(handle);
            Amount everything = holder.balance();
            Address reserve = escrow.getEscrowerReserve();
            if (everything.isPositive() && trySend(handle, holder, reserve, everything)) {
                recordPayoutLocked(handle, escrow, Party.ESCROWER, Amount.min(everything, escrow.getAmount()));
                escrow.setUnreturnedExcess(Amount.ZERO);
                queueOnFundsTransferred(handle, Party.ESCROWER, reserve, everything);
            } else {
                log.warn("Force refund payout for escrow {} failed, {} left for withdrawal", handle,
                        escrow.getEscrowerBalance());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles the trades agreed so far and locks one more trade behind a hash puzzle. The payee is credited
     * prevAmountTraded, the escrower everything that is neither already traded nor locked, and tradeAmount waits
     * for {@link #solvePuzzle} or {@link #refundPuzzle}. Nothing is paid out; both parties collect with
     * {@link #withdraw}.
     *
     * @param prevAmountTraded value already traded to the payee
     * @param tradeAmount value locked behind the puzzle
     * @param puzzleHash SHA-256 of the secret preimage
     * @param puzzleTimelock time after which the escrower may reclaim tradeAmount
     * @param escrowerSig the escrower trade key's signature over the puzzle message
     * @param payeeSig the payee trade key's signature over the puzzle message
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#OPEN}
     * @throws EscrowException.InvalidParameters if the two amounts together exceed the escrow amount
     * @throws EscrowException.InvalidSignature if either signature is not from the expected trade key
     */
    public void postPuzzle(Address handle, Amount prevAmountTraded, Amount tradeAmount, Bytes32 puzzleHash,
                           long puzzleTimelock, byte[] escrowerSig, byte[] payeeSig) {
        checkNotNull(prevAmountTraded);
        checkNotNull(tradeAmount);
        checkNotNull(puzzleHash);
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.OPEN);
            if (prevAmountTraded.getValue().add(tradeAmount.getValue()).compareTo(escrow.getAmount().getValue()) > 0)
                throw new EscrowException.InvalidParameters("Trade amounts exceed escrow amount");
            if (puzzleTimelock < 0)
                throw new EscrowException.InvalidParameters("Puzzle timelock must not be negative");
            Bytes32 digest = EscrowMessages.puzzleDigest(params, handle, prevAmountTraded, tradeAmount, puzzleHash,
                    puzzleTimelock);
            if (!SignatureVerifier.verify(digest, escrowerSig, escrow.getEscrowerTrade()))
                throw new EscrowException.InvalidSignature("Invalid escrower puzzle sig");
            if (!SignatureVerifier.verify(digest, payeeSig, escrow.getPayeeTrade()))
                throw new EscrowException.InvalidSignature("Invalid payee puzzle sig");

            PuzzleRecord puzzle = new PuzzleRecord(tradeAmount, puzzleHash, puzzleTimelock, digest);
            puzzles.put(handle, puzzle);
            escrow.setBalance(Party.PAYEE, prevAmountTraded);
            escrow.setBalance(Party.ESCROWER, escrow.getAmount().subtract(prevAmountTraded).subtract(tradeAmount));
            escrow.transition(EscrowState.PUZZLE_POSTED);
            log.info("Puzzle {} posted for escrow {}, {} locked until {}", puzzleHash, handle, tradeAmount,
                    puzzleTimelock);
            queueOnPuzzlePosted(handle, puzzle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Solves the posted puzzle, crediting its trade amount to the payee and closing the escrow. Publishing the
     * preimage here is what lets the other side of the swap claim the counterpart on the other chain.
     *
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#PUZZLE_POSTED}
     * @throws EscrowException.InvalidPreimage if the SHA-256 of the preimage is not the puzzle hash
     */
    public void solvePuzzle(Address handle, Bytes32 preimage) {
        checkNotNull(preimage);
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.PUZZLE_POSTED);
            PuzzleRecord puzzle = puzzles.get(handle);
            checkState(puzzle != null, "No puzzle recorded for %s", handle);
            if (!puzzle.isSolvedBy(preimage))
                throw new EscrowException.InvalidPreimage();

            escrow.credit(Party.PAYEE, puzzle.getTradeAmount());
            escrow.transition(EscrowState.CLOSED);
            log.info("Puzzle {} of escrow {} solved", puzzle.getPuzzleHash(), handle);
            queueOnPreimageRevealed(handle, preimage, puzzle.getPuzzleHash());
            queueOnEscrowClosed(handle, CloseReason.PUZZLE_SOLVED, escrow.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the trade amount of an unsolved puzzle to the escrower once the puzzle timelock has passed, and closes
     * the escrow.
     *
     * @throws EscrowException.InvalidState if the escrow is not {@link EscrowState#PUZZLE_POSTED}
     * @throws EscrowException.TimelockNotReached if the puzzle timelock has not passed
     */
    public void refundPuzzle(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            escrow.checkState(EscrowState.PUZZLE_POSTED);
            PuzzleRecord puzzle = puzzles.get(handle);
            checkState(puzzle != null, "No puzzle recorded for %s", handle);
            if (Utils.currentTimeSeconds() < puzzle.getPuzzleTimelock())
                throw new EscrowException.TimelockNotReached("Puzzle timelock not reached");

            escrow.credit(Party.ESCROWER, puzzle.getTradeAmount());
            escrow.transition(EscrowState.CLOSED);
            log.info("Puzzle {} of escrow {} refunded", puzzle.getPuzzleHash(), handle);
            queueOnEscrowClosed(handle, CloseReason.PUZZLE_REFUNDED, escrow.copy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pays out a party's whole internal balance to its reserve address. This works in any state, and with
     * {@link #withdrawExcess} is the only way to collect anything once an escrow is closed.
     *
     * @return the amount paid out
     * @throws EscrowException.InvalidState if the escrow does not exist or the party has nothing to withdraw
     * @throws EscrowException.TransferFailed if the asset holder refused the transfer; the balance stays credited
     */
    public Amount withdraw(Address handle, Party claimant) {
        checkNotNull(claimant);
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            Amount due = escrow.getBalance(claimant);
            if (due.isZero())
                throw new EscrowException.InvalidState("No " + claimant.name().toLowerCase() + " balance to withdraw");
            if (!payOutLocked(handle, escrow, claimant))
                throw new EscrowException.TransferFailed("Transfer of " + due + " to "
                        + escrow.getReserve(claimant) + " failed");
            log.info("Withdrew {} for {} of escrow {}", due, claimant, handle);
            return due;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pays out the internal balances of both parties. A refused transfer to one party does not stop the other's,
     * and leaves the refused party's balance credited.
     *
     * @return the amounts actually paid out, keyed by party; parties with nothing paid are absent
     * @throws EscrowException.InvalidState if the escrow does not exist or neither party has a balance
     * @throws EscrowException.TransferFailed if there was something to pay but every transfer was refused
     */
    public Map<Party, Amount> withdrawAll(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            if (escrow.getTotalCredited().isZero())
                throw new EscrowException.InvalidState("No balance to withdraw");
            ImmutableMap.Builder<Party, Amount> paid = ImmutableMap.builder();
            for (Party party : Party.values()) {
                Amount due = escrow.getBalance(party);
                if (due.isZero())
                    continue;
                if (payOutLocked(handle, escrow, party))
                    paid.put(party, due);
                else
                    log.warn("Transfer of {} to {} for escrow {} failed, balance kept", due, party, handle);
            }
            Map<Party, Amount> result = paid.build();
            if (result.isEmpty())
                throw new EscrowException.TransferFailed("All transfers for escrow " + handle + " failed");
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends over-funding that the asset holder refused to return at {@link #open} to the escrower's reserve. This
     * works in any state, so the excess is recoverable even after the escrow has closed.
     *
     * @return the amount paid out
     * @throws EscrowException.InvalidState if the escrow does not exist or has no unreturned excess
     * @throws EscrowException.TransferFailed if the asset holder refused the transfer; the excess stays owed
     */
    public Amount withdrawExcess(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = getRecordLocked(handle);
            Amount excess = escrow.getUnreturnedExcess();
            if (excess.isZero())
                throw new EscrowException.InvalidState("No excess funding to withdraw");
            Address reserve = escrow.getEscrowerReserve();
            if (!trySend(handle, assetHolders.get(handle), reserve, excess))
                throw new EscrowException.TransferFailed("Return of excess " + excess + " to " + reserve + " failed");
            escrow.setUnreturnedExcess(Amount.ZERO);
            log.info("Returned excess funding of {} for escrow {}", excess, handle);
            queueOnFundsTransferred(handle, Party.ESCROWER, reserve, excess);
            return excess;
        } finally {
            lock.unlock();
        }
    }

    /** Returns the current state of the escrow, or {@link EscrowState#NONE} if the handle is unknown. */
    public EscrowState getState(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = escrows.get(handle);
            return escrow == null ? EscrowState.NONE : escrow.getState();
        } finally {
            lock.unlock();
        }
    }

    /** Returns a snapshot of the escrow, or null if the handle is unknown. */
    @Nullable
    public EscrowRecord getEscrow(Address handle) {
        lock.lock();
        try {
            EscrowRecord escrow = escrows.get(handle);
            return escrow == null ? null : escrow.copy();
        } finally {
            lock.unlock();
        }
    }

    /** Returns the puzzle posted for the escrow, or null if none was ever posted. */
    @Nullable
    public PuzzleRecord getPuzzle(Address handle) {
        lock.lock();
        try {
            return puzzles.get(handle);
        } finally {
            lock.unlock();
        }
    }

    /** Returns how much has been paid out to the party's reserve from the escrow so far. */
    public Amount getPaidOut(Address handle, Party party) {
        lock.lock();
        try {
            EnumMap<Party, Amount> paid = paidOut.get(handle);
            if (paid == null)
                return Amount.ZERO;
            Amount amount = paid.get(party);
            return amount == null ? Amount.ZERO : amount;
        } finally {
            lock.unlock();
        }
    }

    /** Returns the time at which {@link #forceRefund} becomes possible for the escrow. */
    public long getForceRefundTimelock(Address handle) {
        lock.lock();
        try {
            return getForceRefundTimelock(getRecordLocked(handle));
        } finally {
            lock.unlock();
        }
    }

    /** Returns the number of escrows ever registered. */
    public int getEscrowCount() {
        lock.lock();
        try {
            return escrows.size();
        } finally {
            lock.unlock();
        }
    }

    private long getForceRefundTimelock(EscrowRecord escrow) {
        return LongMath.saturatedAdd(escrow.getTimelock(), params.getForceRefundGraceSeconds());
    }

    @GuardedBy("lock")
    private EscrowRecord getRecordLocked(Address handle) {
        checkNotNull(handle);
        EscrowRecord escrow = escrows.get(handle);
        if (escrow == null)
            throw new EscrowException.InvalidState("Escrow does not exist: " + handle);
        return escrow;
    }

    private static void checkTradedAmount(EscrowRecord escrow, Amount amountTraded) {
        if (amountTraded.isGreaterThan(escrow.getAmount()))
            throw new EscrowException.InvalidParameters("Amount traded " + amountTraded + " exceeds escrow amount "
                    + escrow.getAmount());
    }

    /** Applies a final split, closes the escrow and pushes both shares out. */
    @GuardedBy("lock")
    private void closeWithSplitLocked(Address handle, EscrowRecord escrow, Amount amountTraded, CloseReason reason) {
        escrow.setBalance(Party.PAYEE, amountTraded);
        escrow.setBalance(Party.ESCROWER, escrow.getAmount().subtract(amountTraded));
        escrow.transition(EscrowState.CLOSED);
        log.info("Escrow {} closed by {}: escrower {}, payee {}", handle, reason, escrow.getEscrowerBalance(),
                escrow.getPayeeBalance());
        queueOnEscrowClosed(handle, reason, escrow.copy());
        for (Party party : Party.values()) {
            if (escrow.getBalance(party).isPositive() && !payOutLocked(handle, escrow, party))
                log.warn("Payout of {} to {} for escrow {} failed, left for withdrawal", escrow.getBalance(party),
                        party, handle);
        }
    }

    /**
     * Sends the party's whole balance to its reserve. The balance is cleared only if the asset holder reports
     * success.
     */
    @GuardedBy("lock")
    private boolean payOutLocked(Address handle, EscrowRecord escrow, Party party) {
        Amount due = escrow.getBalance(party);
        Address reserve = escrow.getReserve(party);
        if (!trySend(handle, assetHolders.get(handle), reserve, due))
            return false;
        recordPayoutLocked(handle, escrow, party, due);
        queueOnFundsTransferred(handle, party, reserve, due);
        return true;
    }

    @GuardedBy("lock")
    private void recordPayoutLocked(Address handle, EscrowRecord escrow, Party party, Amount amount) {
        escrow.setBalance(party, escrow.getBalance(party).subtract(amount));
        EnumMap<Party, Amount> paid = paidOut.get(handle);
        Amount before = paid.get(party);
        paid.put(party, before == null ? amount : before.add(amount));
    }

    // Any exception from the holder counts as a refused transfer.
    private static boolean trySend(Address handle, AssetHolder holder, Address recipient, Amount amount) {
        try {
            return holder.send(recipient, amount);
        } catch (RuntimeException e) {
            log.warn("Asset holder of escrow " + handle + " threw while sending " + amount + " to " + recipient, e);
            return false;
        }
    }

    //region Event listeners

    /**
     * Adds an event listener object. Methods on this object are called when escrows change state. Runs the listener
     * methods in the user thread.
     */
    public void addEventListener(EscrowEventListener listener) {
        addEventListener(Threading.USER_THREAD, listener);
    }

    /**
     * Adds an event listener object. Methods on this object are called when escrows change state. The listener is
     * executed by the given executor.
     */
    public void addEventListener(Executor executor, EscrowEventListener listener) {
        eventListeners.add(new ListenerRegistration<>(listener, executor));
    }

    /**
     * Removes the given event listener object. Returns true if the listener was removed, false if that listener
     * was never added.
     */
    public boolean removeEventListener(EscrowEventListener listener) {
        return ListenerRegistration.removeFromList(listener, eventListeners);
    }

    // A listener that throws, or an executor that rejects the task, must not fail a call that already committed.
    private static void dispatch(ListenerRegistration<EscrowEventListener> registration, Runnable event) {
        try {
            registration.executor.execute(event);
        } catch (RuntimeException e) {
            log.warn("Exception dispatching escrow event to " + registration.listener, e);
            Thread.UncaughtExceptionHandler handler = Threading.uncaughtExceptionHandler;
            if (handler != null)
                handler.uncaughtException(Thread.currentThread(), e);
        }
    }

    private void queueOnEscrowCreated(final Address handle, final EscrowRecord escrow) {
        for (final ListenerRegistration<EscrowEventListener> registration : eventListeners) {
            dispatch(registration, new Runnable() {
                @Override
                public void run() {
                    registration.listener.onEscrowCreated(handle, escrow);
                }
            });
        }
    }

    private void queueOnEscrowFunded(final Address handle, final Amount amount) {
        for (final ListenerRegistration<EscrowEventListener> registration : eventListeners) {
            dispatch(registration, new Runnable() {
                @Override
                public void run() {
                    registration.listener.onEscrowFunded(handle, amount);
                }
            });
        }
    }

    private void queueOnPuzzlePosted(final Address handle, final PuzzleRecord puzzle) {
        for (final ListenerRegistration<EscrowEventListener> registration : eventListeners) {
            dispatch(registration, new Runnable() {
                @Override
                public void run() {
                    registration.listener.onPuzzlePosted(handle, puzzle);
                }
            });
        }
    }

    private void queueOnPreimageRevealed(final Address handle, final Bytes32 preimage, final Bytes32 puzzleHash) {
        for (final ListenerRegistration<EscrowEventListener> registration : eventListeners) {
            dispatch(registration, new Runnable() {
                @Override
                public void run() {
                    registration.listener.onPreimageRevealed(handle, preimage, puzzleHash);
                }
            });
        }
    }

    private void queueOnEscrowClosed(final Address handle, final CloseReason reason, final EscrowRecord escrow) {
        for (final ListenerRegistration<EscrowEventListener> registration : eventListeners) {
            dispatch(registration, new Runnable() {
                @Override
                public void run() {
                    registration.listener.onEscrowClosed(handle, reason, escrow);
                }
            });
        }
    }

    private void queueOnFundsTransferred(final Address handle, final Party party, final Address recipient,
                                         final Amount amount) {
        for (final ListenerRegistration<EscrowEventListener> registration : eventListeners) {
            dispatch(registration, new Runnable() {
                @Override
                public void run() {
                    registration.listener.onFundsTransferred(handle, party, recipient, amount);
                }
            });
        }
    }

    //endregion
}
