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

/**
 * Thrown when an escrow transition is rejected. The registry checks every guard before it changes anything, so when
 * one of these is thrown the escrow is exactly as it was before the call. Callers fix their inputs, or wait, and try
 * again.
 */
public class EscrowException extends RuntimeException {
    public EscrowException(String msg) {
        super(msg);
    }

    /** The escrow is not in a state that permits the requested transition, or does not exist. */
    public static class InvalidState extends EscrowException {
        public InvalidState(String msg) {
            super(msg);
        }
    }

    /** A signature did not recover to the key the escrow has on record for that role. */
    public static class InvalidSignature extends EscrowException {
        public InvalidSignature(String msg) {
            super(msg);
        }
    }

    /** The revealed preimage does not hash to the posted puzzle. */
    public static class InvalidPreimage extends EscrowException {
        public InvalidPreimage() {
            super("Invalid preimage");
        }
    }

    /** A timelock guarding the transition has not yet passed. */
    public static class TimelockNotReached extends EscrowException {
        public TimelockNotReached(String msg) {
            super(msg);
        }
    }

    /**
     * The request would break an escrow invariant: a zero escrow amount, a duplicate registration, an asset holder
     * that does not live at the handle, or trade amounts that add up to more than the escrow holds.
     */
    public static class InvalidParameters extends EscrowException {
        public InvalidParameters(String msg) {
            super(msg);
        }
    }

    /** The asset holder refused to pay out a withdrawal. The credit is left in place. */
    public static class TransferFailed extends EscrowException {
        public TransferFailed(String msg) {
            super(msg);
        }
    }
}
