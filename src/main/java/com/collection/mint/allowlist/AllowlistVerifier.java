package com.collection.mint.allowlist;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks merkle inclusion proofs against a published allowlist root.
 *
 * <p>The leaf is {@code keccak256(address)}; each proof element is folded in
 * with sorted-pair hashing. A proof is accepted only when the fold ends on
 * exactly the stored root. An unset (all-zero) root accepts nothing.</p>
 */
public class AllowlistVerifier {
    private static final Logger log = LoggerFactory.getLogger(AllowlistVerifier.class);

    /**
     * Returns true if {@code proof} shows {@code identity} belongs to the set committed to by {@code root}.
     */
    public boolean verify(Address identity, List<Bytes32> proof, Bytes32 root) {
        if (identity == null || proof == null || root == null || root.isZero()) {
            log.debug("Allowlist proof rejected: missing identity, proof or root");
            return false;
        }
        Bytes32 computed = Keccak.leaf(identity);
        for (Bytes32 sibling : proof) {
            if (sibling == null) {
                log.debug("Allowlist proof rejected for {}: null element", identity);
                return false;
            }
            computed = Keccak.hashSortedPair(computed, sibling);
        }
        boolean valid = computed.equals(root);
        if (!valid) {
            log.debug("Allowlist proof rejected for {}: folded to {} expected {}", identity, computed, root);
        }
        return valid;
    }
}
