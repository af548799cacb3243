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

package org.escrowj.testing;

import org.escrowj.core.Address;
import org.escrowj.core.Amount;
import org.escrowj.escrow.AssetHolder;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An in-memory {@link AssetHolder}. Transfers move value from the holder's balance to a per-recipient tally, and can
 * be made to fail for everybody or for chosen recipients.
 */
public class FakeAssetHolder implements AssetHolder {
    private final Address address;
    private Amount balance = Amount.ZERO;
    private final Map<Address, Amount> received = new HashMap<>();
    private final Set<Address> refusingRecipients = new HashSet<>();
    private boolean failAllSends;
    private int sendAttempts;

    public FakeAssetHolder(Address address) {
        this.address = checkNotNull(address);
    }

    /** Returns a provider that hands out one FakeAssetHolder per handle and remembers it. */
    public static Provider newProvider() {
        return new Provider();
    }

    /** Simulates value arriving at the holder. */
    public FakeAssetHolder fund(Amount amount) {
        balance = balance.add(amount);
        return this;
    }

    public void setFailAllSends(boolean failAllSends) {
        this.failAllSends = failAllSends;
    }

    public void refuseTransfersTo(Address recipient) {
        refusingRecipients.add(recipient);
    }

    public void acceptTransfersTo(Address recipient) {
        refusingRecipients.remove(recipient);
    }

    /** Total value sent to the recipient so far. */
    public Amount getReceived(Address recipient) {
        Amount amount = received.get(recipient);
        return amount == null ? Amount.ZERO : amount;
    }

    public int getSendAttempts() {
        return sendAttempts;
    }

    @Override
    public Address getAddress() {
        return address;
    }

    @Override
    public Amount balance() {
        return balance;
    }

    @Override
    public boolean send(Address recipient, Amount amount) {
        sendAttempts++;
        if (failAllSends || refusingRecipients.contains(recipient) || amount.isGreaterThan(balance))
            return false;
        balance = balance.subtract(amount);
        received.put(recipient, getReceived(recipient).add(amount));
        return true;
    }

    public static class Provider implements AssetHolder.Provider {
        private final Map<Address, FakeAssetHolder> holders = new HashMap<>();

        /** Returns the holder at the handle, creating an empty one the first time. */
        @Override
        public FakeAssetHolder getAssetHolder(Address handle) {
            FakeAssetHolder holder = holders.get(handle);
            if (holder == null) {
                holder = new FakeAssetHolder(handle);
                holders.put(handle, holder);
            }
            return holder;
        }
    }
}
