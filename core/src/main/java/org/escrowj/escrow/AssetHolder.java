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

/**
 * <p>Custodies the value of one escrow. There is one implementation per kind of asset (the native currency, a
 * fungible token), and they all look the same to the registry: a balance, and a way to send part of it.</p>
 *
 * <p>{@link #send} may fail, for example because the recipient refuses the transfer. The registry never assumes a
 * payout happened unless send returns true.</p>
 */
public interface AssetHolder {

    /** The address the holder lives at. This is the escrow's handle. */
    Address getAddress();

    /** Current value held. */
    Amount balance();

    /**
     * Transfers the given amount to the recipient.
     *
     * @return true if and only if the transfer happened
     */
    boolean send(Address recipient, Amount amount);

    /** Supplies the asset holder that custodies value for a given escrow handle. */
    interface Provider {
        AssetHolder getAssetHolder(Address handle);
    }
}
