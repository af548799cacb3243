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
import org.escrowj.core.EscrowParameters;
import org.escrowj.core.Utils;
import org.escrowj.crypto.EthKey;
import org.escrowj.escrow.EscrowRegistry;
import org.escrowj.escrow.EscrowSigner;
import org.escrowj.escrow.EscrowTerms;
import org.escrowj.params.UnitTestParams;

/**
 * Keys, addresses and a registry for escrow tests. Call {@link #setUp()} from a {@code @Before} method and
 * {@link #tearDown()} from an {@code @After} method.
 */
public class EscrowFixture {
    public static final long NOW = 1500000000;
    public static final long ONE_DAY = 24 * 60 * 60;

    public final EscrowParameters params = UnitTestParams.get();

    public EscrowRegistry registry;
    public EscrowRegistry.Registrar registrar;

    public EthKey escrowerTradeKey, escrowerRefundKey, payeeTradeKey;
    public EscrowSigner escrowerTrade, escrowerRefund, payeeTrade;
    public Address escrowerReserve, payeeReserve;

    public void setUp() {
        Utils.setMockClock(NOW);
        registry = new EscrowRegistry(params);
        registrar = registry.newRegistrar();
        escrowerTradeKey = new EthKey();
        escrowerRefundKey = new EthKey();
        payeeTradeKey = new EthKey();
        escrowerTrade = new EscrowSigner(params, escrowerTradeKey);
        escrowerRefund = new EscrowSigner(params, escrowerRefundKey);
        payeeTrade = new EscrowSigner(params, payeeTradeKey);
        escrowerReserve = new EthKey().getAddress();
        payeeReserve = new EthKey().getAddress();
    }

    public void tearDown() {
        Utils.resetMocking();
    }

    /** Terms between the fixture's parties, with the timelock one day from now. */
    public EscrowTerms terms(long amount) {
        return terms(amount, NOW + ONE_DAY);
    }

    public EscrowTerms terms(long amount, long timelock) {
        return EscrowTerms.builder()
                .amount(Amount.valueOf(amount))
                .timelock(timelock)
                .escrowerReserve(escrowerReserve)
                .escrowerTrade(escrowerTradeKey.getAddress())
                .escrowerRefund(escrowerRefundKey.getAddress())
                .payeeReserve(payeeReserve)
                .payeeTrade(payeeTradeKey.getAddress())
                .build();
    }

    /** Registers an escrow at a fresh handle, backed by a FakeAssetHolder holding funding. */
    public FakeAssetHolder register(EscrowTerms terms, long funding) {
        FakeAssetHolder holder = new FakeAssetHolder(new EthKey().getAddress());
        holder.fund(Amount.valueOf(funding));
        registrar.register(holder.getAddress(), terms, holder);
        return holder;
    }

    /** Registers and opens an escrow of the given amount, funded exactly. */
    public FakeAssetHolder openEscrow(long amount) {
        FakeAssetHolder holder = register(terms(amount), amount);
        registry.open(holder.getAddress());
        return holder;
    }
}
