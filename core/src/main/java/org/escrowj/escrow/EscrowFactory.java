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

import com.google.common.primitives.Bytes;
import org.escrowj.core.Address;
import org.escrowj.core.Bytes32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Creates escrows at deterministic handles. The handle of an escrow is the last 20 bytes of
 * {@code keccak256(factoryAddress || paramsHash)}, where paramsHash is the keccak256 of the tightly packed terms
 * (see {@link EscrowTerms#encodePacked()}), followed by the salt when one is given.</p>
 *
 * <p>Because the handle only depends on the terms, the escrower can work it out and send value to it before the
 * escrow exists. {@link #createEscrow(EscrowTerms)} then registers the escrow and opens it straight away.</p>
 *
 * <p>The factory holds the registry's only {@link EscrowRegistry.Registrar}, so it is the only way escrows get
 * into that registry.</p>
 */
public class EscrowFactory {
    private static final Logger log = LoggerFactory.getLogger(EscrowFactory.class);

    private final Address factoryAddress;
    private final EscrowRegistry registry;
    private final EscrowRegistry.Registrar registrar;
    private final AssetHolder.Provider assetHolders;

    /**
     * @param factoryAddress address of this factory, mixed into every handle
     * @param registry registry to create escrows in; must not have issued its registrar yet
     * @param assetHolders source of the asset holder living at each handle
     */
    public EscrowFactory(Address factoryAddress, EscrowRegistry registry, AssetHolder.Provider assetHolders) {
        this.factoryAddress = checkNotNull(factoryAddress);
        this.registry = checkNotNull(registry);
        this.assetHolders = checkNotNull(assetHolders);
        this.registrar = registry.newRegistrar();
    }

    public Address getFactoryAddress() {
        return factoryAddress;
    }

    public EscrowRegistry getRegistry() {
        return registry;
    }

    /** Returns the handle an escrow with these terms gets from this factory. */
    public Address computeHandle(EscrowTerms terms) {
        return computeHandle(terms, null);
    }

    /** Returns the handle an escrow with these terms and salt gets from this factory. */
    public Address computeHandle(EscrowTerms terms, @Nullable Bytes32 salt) {
        Bytes32 paramsHash = getParamsHash(terms, salt);
        return Address.fromDigest(Bytes32.keccak256(Bytes.concat(factoryAddress.getBytes(), paramsHash.getBytes())));
    }

    /**
     * Creates an escrow with the given terms and opens it if its handle already holds enough value.
     *
     * @return the handle of the new escrow
     * @throws EscrowException.InvalidParameters if the amount is zero or an escrow with the same terms exists
     */
    public Address createEscrow(EscrowTerms terms) {
        return createEscrow(terms, null);
    }

    /**
     * Creates an escrow with the given terms and salt and opens it if its handle already holds enough value.
     * Different salts give different handles for the same terms.
     *
     * @return the handle of the new escrow
     * @throws EscrowException.InvalidParameters if the amount is zero or an escrow with the same terms and salt
     * exists
     */
    public Address createEscrow(EscrowTerms terms, @Nullable Bytes32 salt) {
        checkNotNull(terms);
        Address handle = computeHandle(terms, salt);
        AssetHolder holder = checkNotNull(assetHolders.getAssetHolder(handle), "No asset holder for %s", handle);
        registrar.register(handle, terms, holder);
        if (!holder.balance().isLessThan(terms.getAmount())) {
            registry.open(handle);
        } else {
            log.info("Escrow {} created unfunded, holder has {} of {}", handle, holder.balance(), terms.getAmount());
        }
        return handle;
    }

    private static Bytes32 getParamsHash(EscrowTerms terms, @Nullable Bytes32 salt) {
        checkNotNull(terms);
        if (salt == null)
            return terms.getParamsHash();
        return Bytes32.keccak256(Bytes.concat(terms.encodePacked(), salt.getBytes()));
    }
}
