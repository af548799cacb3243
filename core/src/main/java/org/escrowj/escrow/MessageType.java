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
 * Tag byte distinguishing the families of signed escrow messages. It is packed into every message right after the
 * escrow handle so a signature made for one family can never be presented as another.
 */
public enum MessageType {
    NONE(0),
    CASHOUT(1),
    PUZZLE(2),
    REFUND(3);

    public final int value;

    MessageType(int value) {
        this.value = value;
    }

    public byte byteValue() {
        return (byte) value;
    }
}
