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

/** Why an escrow reached {@link EscrowState#CLOSED}. */
public enum CloseReason {
    /** Both trade keys signed the final split. */
    CASHOUT,
    /** The escrower's refund key signed the final split after the escrow timelock. */
    REFUND,
    /** Nobody signed; the grace period after the escrow timelock elapsed and the escrower took everything. */
    FORCE_REFUND,
    /** The payee revealed the preimage of the posted puzzle. */
    PUZZLE_SOLVED,
    /** The puzzle timelock elapsed unsolved and the trade amount went back to the escrower. */
    PUZZLE_REFUNDED
}
