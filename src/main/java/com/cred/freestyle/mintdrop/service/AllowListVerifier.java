package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.infrastructure.ledger.LedgerAddress;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merkle commitments over allow-listed wallets.
 *
 * Tree shape:
 * - leaf: the wallet's 32-byte public key; text that is not a valid address is hashed
 *   with keccak-256 instead
 * - leaves are de-duplicated and sorted bytewise, so the root does not depend on list order
 * - node: keccak-256 of its two children, smaller child first (sorted pairs), so proofs
 *   carry no left/right flags
 * - a node without a sibling is promoted to the next level unchanged
 *
 * A single-member list has the leaf itself as root and an empty proof.
 *
 * @author Mint Drop Team
 */
@Component
public class AllowListVerifier {

    /**
     * Build the root and per-wallet proofs.
     *
     * @param wallets eligible wallet addresses
     * @return commitment over the distinct wallets
     * @throws IllegalArgumentException if no wallet is given
     */
    public AllowListCommitment buildCommitment(Collection<String> wallets) {
        if (wallets == null || wallets.isEmpty()) {
            throw new IllegalArgumentException("Allow list is empty");
        }

        // Step 1: Leaves, distinct and sorted
        Map<String, byte[]> leafByWallet = new LinkedHashMap<>();
        Map<String, byte[]> distinctLeaves = new HashMap<>();
        for (String wallet : wallets) {
            String normalized = wallet.trim();
            byte[] leaf = leafFor(normalized);
            leafByWallet.put(normalized, leaf);
            distinctLeaves.putIfAbsent(Numeric.toHexString(leaf), leaf);
        }
        List<byte[]> leaves = new ArrayList<>(distinctLeaves.values());
        leaves.sort(Arrays::compareUnsigned);

        // Step 2: Levels, bottom-up
        List<List<byte[]>> levels = new ArrayList<>();
        levels.add(leaves);
        while (levels.get(levels.size() - 1).size() > 1) {
            levels.add(nextLevel(levels.get(levels.size() - 1)));
        }
        byte[] root = levels.get(levels.size() - 1).get(0);

        // Step 3: Proof per wallet
        Map<String, Integer> leafIndex = new HashMap<>();
        for (int i = 0; i < leaves.size(); i++) {
            leafIndex.put(Numeric.toHexString(leaves.get(i)), i);
        }
        Map<String, List<String>> proofs = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : leafByWallet.entrySet()) {
            int index = leafIndex.get(Numeric.toHexString(entry.getValue()));
            proofs.put(entry.getKey(), Collections.unmodifiableList(proofFor(levels, index)));
        }

        return new AllowListCommitment(Numeric.toHexString(root), Collections.unmodifiableMap(proofs));
    }

    /**
     * Recompute the root from the wallet's leaf and proof and compare it byte-for-byte.
     *
     * @return false for a malformed proof or root, never throws on bad input
     */
    public boolean verify(String wallet, List<String> proof, String root) {
        if (wallet == null || wallet.isBlank() || root == null || root.isBlank()) {
            return false;
        }
        try {
            byte[] computed = leafFor(wallet.trim());
            if (proof != null) {
                for (String siblingHex : proof) {
                    byte[] sibling = Numeric.hexStringToByteArray(siblingHex);
                    if (sibling.length != 32) {
                        return false;
                    }
                    computed = hashPair(computed, sibling);
                }
            }
            return Arrays.equals(computed, Numeric.hexStringToByteArray(root));
        } catch (RuntimeException e) {
            // Malformed hex
            return false;
        }
    }

    byte[] leafFor(String wallet) {
        if (LedgerAddress.isValid(wallet)) {
            return LedgerAddress.decode(wallet);
        }
        return Hash.sha3(wallet.getBytes(StandardCharsets.UTF_8));
    }

    private static List<byte[]> nextLevel(List<byte[]> level) {
        List<byte[]> next = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i < level.size(); i += 2) {
            if (i + 1 < level.size()) {
                next.add(hashPair(level.get(i), level.get(i + 1)));
            } else {
                next.add(level.get(i));
            }
        }
        return next;
    }

    private static List<String> proofFor(List<List<byte[]>> levels, int leafIndex) {
        List<String> proof = new ArrayList<>();
        int index = leafIndex;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<byte[]> level = levels.get(depth);
            int siblingIndex = (index % 2 == 0) ? index + 1 : index - 1;
            if (siblingIndex < level.size()) {
                proof.add(Numeric.toHexString(level.get(siblingIndex)));
            }
            index /= 2;
        }
        return proof;
    }

    private static byte[] hashPair(byte[] a, byte[] b) {
        byte[] combined = new byte[a.length + b.length];
        if (Arrays.compareUnsigned(a, b) <= 0) {
            System.arraycopy(a, 0, combined, 0, a.length);
            System.arraycopy(b, 0, combined, a.length, b.length);
        } else {
            System.arraycopy(b, 0, combined, 0, b.length);
            System.arraycopy(a, 0, combined, b.length, a.length);
        }
        return Hash.sha3(combined);
    }
}
