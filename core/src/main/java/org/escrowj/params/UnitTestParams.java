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

package org.escrowj.params;

import org.escrowj.core.EscrowParameters;

/**
 * Parameters for unit tests. The protocol constants are the production ones so tests exercise the same timelock
 * arithmetic; only the ID differs, which keeps test registries from being mistaken for real ones in logs.
 */
public class UnitTestParams extends EscrowParameters {

    public UnitTestParams() {
        super();
        id = ID_UNITTESTNET;
    }

    private static UnitTestParams instance;
    public static synchronized UnitTestParams get() {
        if (instance == null) {
            instance = new UnitTestParams();
        }
        return instance;
    }
}
