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
import org.escrowj.core.Address;
import org.escrowj.core.Amount;
import org.escrowj.core.Bytes32;
import org.escrowj.core.Utils;

import java.nio.ByteBuffer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>The immutable parameters two counterparties agree on before an escrow exists: how much is escrowed, when the
 * escrower may refund unilaterally, and the five addresses that receive funds or authorize transitions.</p>
 *
 * <p>Terms are validated only for shape here. Whether they are acceptable (a positive amount, for instance) is
 * decided by the registry at registration, so that a rejected registration is reported like every other rejected
 * escrow operation.</p>
 */
public class EscrowTerms {
    /** Length of {@link #encodePacked()}: two 32 byte words and five addresses. */
    public static final int PACKED_LENGTH = 2 * 32 + 5 * Address.LENGTH;

    private final Amount amount;
    private final long timelock;
    private final Address escrowerReserve;
    private final Address escrowerTrade;
    private final Address escrowerRefund;
    private final Address payeeReserve;
    private final Address payeeTrade;

    private EscrowTerms(Builder builder) {
        this.amount = checkNotNull(builder.amount, "amount");
        checkArgument(builder.timelock >= 0, "timelock must not be negative: %s", builder.timelock);
        this.timelock = builder.timelock;
        this.escrowerReserve = checkNotNull(builder.escrowerReserve, "escrowerReserve");
        this.escrowerTrade = checkNotNull(builder.escrowerTrade, "escrowerTrade");
        this.escrowerRefund = checkNotNull(builder.escrowerRefund, "escrowerRefund");
        this.payeeReserve = checkNotNull(builder.payeeReserve, "payeeReserve");
        this.payeeTrade = checkNotNull(builder.payeeTrade, "payeeTrade");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Total value that must be deposited before the escrow can open. */
    public Amount getAmount() {
        return amount;
    }

    /** Earliest time (seconds since the epoch) at which the escrower may make a signed refund. */
    public long getTimelock() {
        return timelock;
    }

    public Address getEscrowerReserve() {
        return escrowerReserve;
    }

    public Address getEscrowerTrade() {
        return escrowerTrade;
    }

    public Address getEscrowerRefund() {
        return escrowerRefund;
    }

    public Address getPayeeReserve() {
        return payeeReserve;
    }

    public Address getPayeeTrade() {
        return payeeTrade;
    }

    /**
     * Tightly packs the terms in declaration order: amount and timelock as 32 byte big endian words, then the
     * escrower's reserve, trade and refund addresses and the payee's reserve and trade addresses.
     */
    public byte[] encodePacked() {
        ByteBuffer buf = ByteBuffer.allocate(PACKED_LENGTH);
        buf.put(amount.toBytes());
        buf.put(Utils.uint256ToBytes(timelock));
        buf.put(escrowerReserve.getBytes());
        buf.put(escrowerTrade.getBytes());
        buf.put(escrowerRefund.getBytes());
        buf.put(payeeReserve.getBytes());
        buf.put(payeeTrade.getBytes());
        return buf.array();
    }

    /** Keccak-256 of {@link #encodePacked()}. */
    public Bytes32 getParamsHash() {
        return Bytes32.keccak256(encodePacked());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EscrowTerms other = (EscrowTerms) o;
        return timelock == other.timelock
                && amount.equals(other.amount)
                && escrowerReserve.equals(other.escrowerReserve)
                && escrowerTrade.equals(other.escrowerTrade)
                && escrowerRefund.equals(other.escrowerRefund)
                && payeeReserve.equals(other.payeeReserve)
                && payeeTrade.equals(other.payeeTrade);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(amount, timelock, escrowerReserve, escrowerTrade, escrowerRefund, payeeReserve,
                payeeTrade);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("amount", amount)
                .add("timelock", timelock)
                .add("escrowerReserve", escrowerReserve)
                .add("escrowerTrade", escrowerTrade)
                .add("escrowerRefund", escrowerRefund)
                .add("payeeReserve", payeeReserve)
                .add("payeeTrade", payeeTrade)
                .toString();
    }

    public static class Builder {
        private Amount amount;
        private long timelock;
        private Address escrowerReserve;
        private Address escrowerTrade;
        private Address escrowerRefund;
        private Address payeeReserve;
        private Address payeeTrade;

        private Builder() {
        }

        public Builder amount(Amount amount) {
            this.amount = amount;
            return this;
        }

        public Builder timelock(long timelock) {
            this.timelock = timelock;
            return this;
        }

        public Builder escrowerReserve(Address escrowerReserve) {
            this.escrowerReserve = escrowerReserve;
            return this;
        }

        public Builder escrowerTrade(Address escrowerTrade) {
            this.escrowerTrade = escrowerTrade;
            return this;
        }

        public Builder escrowerRefund(Address escrowerRefund) {
            this.escrowerRefund = escrowerRefund;
            return this;
        }

        public Builder payeeReserve(Address payeeReserve) {
            this.payeeReserve = payeeReserve;
            return this;
        }

        public Builder payeeTrade(Address payeeTrade) {
            this.payeeTrade = payeeTrade;
            return this;
        }

        public EscrowTerms build() {
            return new EscrowTerms(this);
        }
    }
}
