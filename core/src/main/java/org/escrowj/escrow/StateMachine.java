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

import com.google.common.collect.ImmutableMultimap;
import com.google.common.collect.Multimap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A class representing a state machine, with limited transitions between states. Checking the current state
 * reports an {@link EscrowException.InvalidState} because that is a caller mistake; attempting a transition that is
 * not in the table throws {@link IllegalStateException} because that is a bug in the registry.
 *
 * @param <State> An enum of states to use
 */
public class StateMachine<State extends Enum<State>> {
    private State currentState;

    private final Multimap<State, State> transitions;

    public StateMachine(State startState, Multimap<State, State> transitions) {
        currentState = checkNotNull(startState);
        this.transitions = ImmutableMultimap.copyOf(checkNotNull(transitions));
    }

    /**
     * Checks that the machine is in the given state.
     *
     * @throws EscrowException.InvalidState If the machine is not in the given state
     */
    public synchronized void checkState(State requiredState) {
        if (requiredState != currentState) {
            throw new EscrowException.InvalidState(String.format(
                    "Expected state %s, but in state %s", requiredState, currentState));
        }
    }

    /**
     * Transitions to a new state, provided that the required transition exists
     *
     * @param newState The new state to transition to
     * @throws IllegalStateException If no state transition exists from oldState to newState
     */
    public synchronized void transition(State newState) {
        if (transitions.containsEntry(currentState, newState)) {
            currentState = newState;
        } else {
            throw new IllegalStateException(String.format(
                    "Attempted invalid transition from %s to %s", currentState, newState));
        }
    }

    public synchronized State getState() {
        return currentState;
    }

    @Override
    public String toString() {
        return "[" + getState() + "]";
    }
}
