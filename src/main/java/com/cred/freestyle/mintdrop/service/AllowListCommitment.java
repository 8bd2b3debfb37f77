package com.cred.freestyle.mintdrop.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merkle root over an allow-list plus each member's proof.
 *
 * @param root 0x-prefixed hex root
 * @param proofs wallet address to its sibling hashes, leaf level first (hex)
 */
public record AllowListCommitment(String root, Map<String, List<String>> proofs) {

    public Optional<List<String>> proofFor(String wallet) {
        return Optional.ofNullable(proofs.get(wallet == null ? null : wallet.trim()));
    }

    public int size() {
        return proofs.size();
    }
}
