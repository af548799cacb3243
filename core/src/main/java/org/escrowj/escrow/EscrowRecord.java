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
import com.google.common.collect.ImmutableMultimap;
import org.escrowj.core.Address;
import org.escrowj.core.Amount;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Everything the registry knows about one escrow: the agreed {@link EscrowTerms}, the current
 * {@link EscrowState} and the two internal balances, which are value credited to a party but not yet paid out
 * through the asset holder.</p>
 *
 * <p>The registry owns the live records and only ever hands out copies, so an instance obtained from
 * {@link EscrowRegistry#getEscrow} is a snapshot that does not change as the escrow moves on. Records are kept
 * after closing as an audit trail.</p>
 */
public class EscrowRecord {
    // Every legal move. CLOSED has no way out.
    static final ImmutableMultimap<EscrowState, EscrowState> TRANSITIONS =
            ImmutableMultimap.<EscrowState, EscrowState>builder()
                    .put(EscrowState.UNFUNDED, EscrowState.OPEN)
                    .put(EscrowState.OPEN, EscrowState.PUZZLE_POSTED)
                    .put(EscrowState.OPEN, EscrowState.CLOSED)
                    .put(EscrowState.PUZZLE_POSTED, EscrowState.CLOSED)
                    .build();

    private final EscrowTerms terms;
    private final StateMachine<EscrowState> stateMachine;
    private Amount escrowerBalance = Amount.ZERO;
    private Amount payeeBalance = Amount.ZERO;
    // Over-funding the asset holder refused to return at open. Not part of the escrow amount.
    private Amount unreturnedExcess = Amount.ZERO;

    EscrowRecord(EscrowTerms terms) {
        this.terms = checkNotNull(terms);
        this.stateMachine = new StateMachine<>(EscrowState.UNFUNDED, TRANSITIONS);
    }

    private EscrowRecord(EscrowRecord other) {
        this.terms = other.terms;
        this.stateMachine = new StateMachine<>(other.getState(), TRANSITIONS);
        this.escrowerBalance = other.escrowerBalance;
        this.payeeBalance = other.payeeBalance;
        this.unreturnedExcess = other.unreturnedExcess;
    }

    /** Returns a detached copy of this record. */
    EscrowRecord copy() {
        return new EscrowRecord(this);
    }

    public EscrowTerms getTerms() {
        return terms;
    }

    public Amount getAmount() {
        return terms.getAmount();
    }

    public long getTimelock() {
        return terms.getTimelock();
    }

    public Address getEscrowerReserve() {
        return terms.getEscrowerReserve();
    }

    public Address getEscrowerTrade() {
        return terms.getEscrowerTrade();
    }

    public Address getEscrowerRefund() {
        return terms.getEscrowerRefund();
    }

    public Address getPayeeReserve() {
        return terms.getPayeeReserve();
    }

    public Address getPayeeTrade() {
        return terms.getPayeeTrade();
    }

    public EscrowState getState() {
        return stateMachine.getState();
    }

    public Amount getEscrowerBalance() {
        return escrowerBalance;
    }

    public Amount getPayeeBalance() {
        return payeeBalance;
    }

    /** Returns the internal balance credited to the given party. */
    public Amount getBalance(Party party) {
        return party == Party.ESCROWER ? escrowerBalance : payeeBalance;
    }

    /** Returns the address that the given party's settled funds are paid to. */
    public Address getReserve(Party party) {
        return party == Party.ESCROWER ? terms.getEscrowerReserve() : terms.getPayeeReserve();
    }

    /**
     * Returns value above the escrow amount that the asset holder still holds because returning it to the escrower
     * was refused at open. It is owed to the escrower's reserve and never counts toward the escrow's balances.
     */
    public Amount getUnreturnedExcess() {
        return unreturnedExcess;
    }

    /** Sum of both internal balances. Never more than the escrow amount. */
    public Amount getTotalCredited() {
        return escrowerBalance.add(payeeBalance);
    }

    void checkState(EscrowState requiredState) {
        stateMachine.checkState(requiredState);
    }

    void transition(EscrowState newState) {
        stateMachine.transition(newState);
    }

    void setBalance(Party party, Amount balance) {
        checkNotNull(balance);
        if (party == Party.ESCROWER)
            escrowerBalance = balance;
        else
            payeeBalance = balance;
    }

    void setUnreturnedExcess(Amount excess) {
        unreturnedExcess = checkNotNull(excess);
    }

    void credit(Party party, Amount amount) {
        setBalance(party, getBalance(party).add(amount));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("state", getState())
                .add("amount", terms.getAmount())
                .add("timelock", terms.getTimelock())
                .add("escrowerBalance", escrowerBalance)
                .add("payeeBalance", payeeBalance)
                .add("unreturnedExcess", unreturnedExcess)
                .toString();
    }
}
