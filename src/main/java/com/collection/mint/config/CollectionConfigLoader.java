package com.collection.mint.config;

import com.collection.mint.compliance.CapPolicy;
import com.collection.mint.compliance.MintPolicy;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import com.collection.mint.core.model.CollectionConfig;
import com.collection.mint.core.model.EtherUnits;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a collection deployment from JSON.
 *
 * <p>Expected format (every field optional except {@code admin}; missing sale
 * values fall back to {@link CollectionConfig#defaults()}):</p>
 * <pre>
 * {
 *   "contractName": "WhoIsWho",
 *   "maxSupply": 5000,
 *   "presale": {
 *     "og": {"price": "0.025", "maxTokenPerWallet": 3},
 *     "wl": {"price": "0.025", "maxTokenPerWallet": 2},
 *     "date": 1684172700
 *   },
 *   "publicSale": {"price": "0.03", "date": 1684173900, "maxTokenPerWallet": 5},
 *   "presaleInterval": 900,
 *   "reservedTokens": 50,
 *   "admin": "0x...",
 *   "operators": ["0x...", "0x..."],
 *   "requiredConfirmations": 2
 * }
 * </pre>
 * Prices are decimal ether strings and are converted to wei.
 */
public class CollectionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(CollectionConfigLoader.class);

    /** Classpath resource holding the reference sale values. */
    public static final String DEFAULTS_RESOURCE = "/collection-defaults.json";

    private final ObjectMapper objectMapper;

    public CollectionConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Loads the reference sale configuration bundled with the library.
     */
    public CollectionConfig loadDefaultConfig() {
        try (InputStream in = CollectionConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return toConfig(read(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    public DeploymentSettings load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read deployment settings from " + path, e);
        }
    }

    public DeploymentSettings load(InputStream input) {
        DeploymentJson json = read(input);
        if (json.admin() == null || json.admin().isBlank()) {
            throw new IllegalArgumentException("Deployment settings must name an admin");
        }
        DeploymentSettings settings = new DeploymentSettings(
                json.contractName(),
                json.tokenName(),
                json.tokenSymbol(),
                toConfig(json),
                Address.of(json.admin()),
                toAddresses(json.operators()),
                toAddresses(json.approvers()),
                json.requiredConfirmations(),
                toPolicy(json.policy()),
                json.relay() != null && json.relay().price() != null
                        ? EtherUnits.parseEther(json.relay().price()) : null);
        log.info("config.loaded contract={} admin={} operators={} approvers={}",
                settings.contractName(), settings.admin(), settings.operators().size(), settings.approvers().size());
        return settings;
    }

    private DeploymentJson read(InputStream input) {
        try {
            return objectMapper.readValue(input, DeploymentJson.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid deployment settings: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read deployment settings", e);
        }
    }

    private static CollectionConfig toConfig(DeploymentJson json) {
        CollectionConfig.Builder builder = CollectionConfig.builder();
        if (json.maxSupply() != null) {
            builder.totalSupply(json.maxSupply());
        }
        if (json.presaleInterval() != null) {
            builder.presaleInterval(json.presaleInterval());
        }
        if (json.reservedTokens() != null) {
            builder.reservedTokens(json.reservedTokens());
        }
        if (json.revealDate() != null) {
            builder.revealDate(json.revealDate());
        }
        if (json.metadataBaseURI() != null) {
            builder.metadataBaseURI(json.metadataBaseURI());
        }
        if (json.ogMerkleRoot() != null && !json.ogMerkleRoot().isBlank()) {
            builder.ogMerkleRoot(Bytes32.fromHex(json.ogMerkleRoot()));
        }
        if (json.wlMerkleRoot() != null && !json.wlMerkleRoot().isBlank()) {
            builder.wlMerkleRoot(Bytes32.fromHex(json.wlMerkleRoot()));
        }

        PresaleJson presale = json.presale();
        if (presale != null) {
            if (presale.date() != null) {
                builder.presaleDate(presale.date());
            }
            if (presale.og() != null) {
                if (presale.og().price() != null) {
                    builder.presalePriceOg(EtherUnits.parseEther(presale.og().price()));
                }
                if (presale.og().maxTokenPerWallet() != null) {
                    builder.presaleMaxTokenPerOg(presale.og().maxTokenPerWallet());
                }
            }
            if (presale.wl() != null) {
                if (presale.wl().price() != null) {
                    builder.presalePriceWl(EtherUnits.parseEther(presale.wl().price()));
                }
                if (presale.wl().maxTokenPerWallet() != null) {
                    builder.presaleMaxTokenPerWl(presale.wl().maxTokenPerWallet());
                }
            }
        }

        PublicSaleJson publicSale = json.publicSale();
        if (publicSale != null) {
            if (publicSale.price() != null) {
                builder.price(EtherUnits.parseEther(publicSale.price()));
            }
            if (publicSale.date() != null) {
                builder.publicSaleDate(publicSale.date());
            }
            if (publicSale.maxTokenPerWallet() != null) {
                builder.maxTokenPerWallet(publicSale.maxTokenPerWallet());
            }
            if (publicSale.maxMintPerTx() != null) {
                builder.maxMintPerTx(publicSale.maxMintPerTx());
            }
        }
        return builder.build();
    }

    private static MintPolicy toPolicy(PolicyJson json) {
        MintPolicy.Builder builder = MintPolicy.builder();
        if (json == null) {
            return builder.build();
        }
        if (json.presaleCapPolicy() != null) {
            builder.presaleCapPolicy(CapPolicy.valueOf(json.presaleCapPolicy().trim().toUpperCase()));
        }
        if (json.publicCapPolicy() != null) {
            builder.publicCapPolicy(CapPolicy.valueOf(json.publicCapPolicy().trim().toUpperCase()));
        }
        if (json.stageGatedWithdrawals() != null) {
            builder.stageGatedWithdrawals(json.stageGatedWithdrawals());
        }
        return builder.build();
    }

    private static List<Address> toAddresses(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(Address::of).toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DeploymentJson(
            String contractName,
            String tokenName,
            String tokenSymbol,
            Integer maxSupply,
            PresaleJson presale,
            PublicSaleJson publicSale,
            Long presaleInterval,
            Integer reservedTokens,
            Long revealDate,
            String metadataBaseURI,
            String ogMerkleRoot,
            String wlMerkleRoot,
            String admin,
            List<String> operators,
            List<String> approvers,
            Integer requiredConfirmations,
            PolicyJson policy,
            RelayJson relay
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PresaleJson(ListJson og, ListJson wl, Long date) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ListJson(String price, Integer maxTokenPerWallet) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PublicSaleJson(String price, Long date, Integer maxTokenPerWallet, Integer maxMintPerTx) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PolicyJson(String presaleCapPolicy, String publicCapPolicy, Boolean stageGatedWithdrawals) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RelayJson(String price) {}
}
