package com.cred.freestyle.mintdrop.api.dto;

import com.cred.freestyle.mintdrop.service.AllowListService.CommittedAllowList;

/**
 * @author Mint Drop Team
 */
public class AllowListCommitmentResponse {

    private String phaseId;
    private String merkleRoot;
    private Integer walletCount;

    public AllowListCommitmentResponse() {
    }

    public static AllowListCommitmentResponse fromCommitted(CommittedAllowList committed) {
        AllowListCommitmentResponse response = new AllowListCommitmentResponse();
        response.setPhaseId(committed.phase().getPhaseId());
        response.setMerkleRoot(committed.commitment().root());
        response.setWalletCount(committed.commitment().size());
        return response;
    }

    // Getters and setters
    public String getPhaseId() {
        return phaseId;
    }

    public void setPhaseId(String phaseId) {
        this.phaseId = phaseId;
    }

    public String getMerkleRoot() {
        return merkleRoot;
    }

    public void setMerkleRoot(String merkleRoot) {
        this.merkleRoot = merkleRoot;
    }

    public Integer getWalletCount() {
        return walletCount;
    }

    public void setWalletCount(Integer walletCount) {
        this.walletCount = walletCount;
    }
}
