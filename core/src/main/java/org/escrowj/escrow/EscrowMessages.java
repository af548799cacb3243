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
import org.escrowj.core.Bytes32;
import org.escrowj.core.EscrowParameters;
import org.escrowj.core.Utils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Builds the messages that escrow keys sign, and the digests that are actually signed.</p>
 *
 * <p>A message is the escrow handle, a one byte {@link MessageType} tag and then the fields of that message type,
 * tightly packed with no length prefixes: amounts and timelocks as 32 byte big endian words, hashes as their 32 raw
 * bytes. The signed digest is</p>
 *
 * <pre>keccak256(prefix || decimal(message.length) || message)</pre>
 *
 * <p>which is what standard wallets produce when asked to sign the message bytes. Because the handle and the tag are
 * part of every message, a signature is only good for the one escrow and the one kind of transition it was made
 * for.</p>
 *
 * <p>The declared length is always taken from the bytes actually being hashed, never from a constant, and each
 * builder checks that it produced exactly the number of bytes its layout calls for.</p>
 */
public final class EscrowMessages {

    /** Handle and tag, shared by all message types. */
    public static final int HEADER_LENGTH = Address.LENGTH + 1;

    /** handle, tag, amountTraded */
    public static final int CASHOUT_MESSAGE_LENGTH = HEADER_LENGTH + 32;

    /** handle, tag, amountTraded */
    public static final int REFUND_MESSAGE_LENGTH = HEADER_LENGTH + 32;

    /** handle, tag, prevAmountTraded, tradeAmount, puzzleHash, puzzleTimelock */
    public static final int PUZZLE_MESSAGE_LENGTH = HEADER_LENGTH + 4 * 32;

    private EscrowMessages() {
    }

    public static byte[] cashoutMessage(Address handle, Amount amountTraded) {
        ByteBuffer buf = header(handle, MessageType.CASHOUT, CASHOUT_MESSAGE_LENGTH);
        buf.put(amountTraded.toBytes());
        return finish(buf);
    }

    public static byte[] refundMessage(Address handle, Amount amountTraded) {
        ByteBuffer buf = header(handle, MessageType.REFUND, REFUND_MESSAGE_LENGTH);
        buf.put(amountTraded.toBytes());
        return finish(buf);
    }

    public static byte[] puzzleMessage(Address handle, Amount prevAmountTraded, Amount tradeAmount,
                                       Bytes32 puzzleHash, long puzzleTimelock) {
        checkNotNull(puzzleHash);
        ByteBuffer buf = header(handle, MessageType.PUZZLE, PUZZLE_MESSAGE_LENGTH);
        buf.put(prevAmountTraded.toBytes());
        buf.put(tradeAmount.toBytes());
        buf.put(puzzleHash.getBytes());
        buf.put(Utils.uint256ToBytes(puzzleTimelock));
        return finish(buf);
    }

    /**
     * Returns the digest a wallet signs for the given message: the Keccak-256 hash of the signed message prefix,
     * the message length in decimal ASCII, and the message itself.
     */
    public static Bytes32 toSignableDigest(EscrowParameters params, byte[] message) {
        checkNotNull(message);
        byte[] prefix = params.getSignedMessagePrefixBytes();
        byte[] length = Integer.toString(message.length).getBytes(StandardCharsets.US_ASCII);
        byte[] preimage = new byte[prefix.length + length.length + message.length];
        System.arraycopy(prefix, 0, preimage, 0, prefix.length);
        System.arraycopy(length, 0, preimage, prefix.length, length.length);
        System.arraycopy(message, 0, preimage, prefix.length + length.length, message.length);
        return Bytes32.keccak256(preimage);
    }

    public static Bytes32 cashoutDigest(EscrowParameters params, Address handle, Amount amountTraded) {
        return toSignableDigest(params, cashoutMessage(handle, amountTraded));
    }

    public static Bytes32 refundDigest(EscrowParameters params, Address handle, Amount amountTraded) {
        return toSignableDigest(params, refundMessage(handle, amountTraded));
    }

    public static Bytes32 puzzleDigest(EscrowParameters params, Address handle, Amount prevAmountTraded,
                                       Amount tradeAmount, Bytes32 puzzleHash, long puzzleTimelock) {
        return toSignableDigest(params,
                puzzleMessage(handle, prevAmountTraded, tradeAmount, puzzleHash, puzzleTimelock));
    }

    private static ByteBuffer header(Address handle, MessageType type, int length) {
        checkNotNull(handle);
        checkArgument(type != MessageType.NONE, "NONE is not a signable message type");
        ByteBuffer buf = ByteBuffer.allocate(length);
        buf.put(handle.getBytes());
        buf.put(type.byteValue());
        return buf;
    }

    private static byte[] finish(ByteBuffer buf) {
        checkState(!buf.hasRemaining(), "Message layout mismatch: %s of %s bytes written",
                buf.position(), buf.capacity());
        return buf.array();
    }
}
