package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.service.AllowListService.AllowListProof;

import java.util.List;

/**
 * Merkle proof of a wallet, to be passed as allowlistProof on reserve.
 * committed=false means the phase root was not committed for the current list yet.
 *
 * @author Mint Drop Team
 */
public class AllowListProofResponse {

    private String phaseId;
    private String wallet;
    private String merkleRoot;
    private List<String> proof;
    private boolean committed;

    public AllowListProofResponse() {
    }

    public static AllowListProofResponse fromProof(AllowListProof proof) {
        AllowListProofResponse response = new AllowListProofResponse();
        response.setPhaseId(proof.phaseId());
        response.setWallet(proof.wallet());
        response.setMerkleRoot(proof.root());
        response.setProof(proof.proof());
        response.setCommitted(proof.committed());
        return response;
    }

    // Getters and setters
    public String getPhaseId() {
        return phaseId;
    }

    public void setPhaseId(String phaseId) {
        this.phaseId = phaseId;
    }

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public String getMerkleRoot() {
        return merkleRoot;
    }

    public void setMerkleRoot(String merkleRoot) {
        this.merkleRoot = merkleRoot;
    }

    public List<String> getProof() {
        return proof;
    }

    public void setProof(List<String> proof) {
        this.proof = proof;
    }

    public boolean isCommitted() {
        return committed;
    }

    public void setCommitted(boolean committed) {
        this.committed = committed;
    }
}
