package com.collection.mint.config;

import com.collection.mint.compliance.MintPolicy;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.CollectionConfig;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to stand up one collection: the sale configuration plus
 * the identities and approval rules around it.
 *
 * @param contractName          contract name used in logs
 * @param tokenName             human-readable token name
 * @param tokenSymbol           token ticker
 * @param config                sale configuration
 * @param admin                 holder of the ADMIN role
 * @param operators             addresses granted OPERATOR at construction
 * @param approvers             treasury approvers; empty means operators followed by the admin
 * @param requiredConfirmations treasury quorum, or null for "every approver"
 * @param policy                cap and withdrawal policy
 * @param relayPrice            unit price of the mint relay, or null when no relay is deployed
 */
public record DeploymentSettings(
        String contractName,
        String tokenName,
        String tokenSymbol,
        CollectionConfig config,
        Address admin,
        List<Address> operators,
        List<Address> approvers,
        Integer requiredConfirmations,
        MintPolicy policy,
        BigInteger relayPrice
) {

    public DeploymentSettings {
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(admin, "admin is required");
        operators = operators != null ? List.copyOf(operators) : List.of();
        approvers = approvers != null ? List.copyOf(approvers) : List.of();
        policy = policy != null ? policy : MintPolicy.defaults();
        contractName = contractName != null ? contractName : "Collection";
    }

    public Optional<BigInteger> relayPriceIfSet() {
        return Optional.ofNullable(relayPrice);
    }
}
