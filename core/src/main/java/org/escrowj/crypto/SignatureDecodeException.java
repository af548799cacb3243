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

package org.escrowj.crypto;

/**
 * Thrown when a byte string cannot be interpreted as a recoverable secp256k1 signature.
 */
public class SignatureDecodeException extends Exception {
    public SignatureDecodeException() {
        super();
    }

    public SignatureDecodeException(String message) {
        super(message);
    }

    public SignatureDecodeException(Throwable cause) {
        super(cause);
    }

    public SignatureDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
