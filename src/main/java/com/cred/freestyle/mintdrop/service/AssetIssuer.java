package com.cred.freestyle.mintdrop.service;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.repository.MintInventoryStore.ConfirmedMint;

/**
 * On-chain issuance of confirmed items. Invoked once per newly confirmed mint,
 * after the confirmation has been committed. Never invoked for replays.
 *
 * @author Mint Drop Team
 */
public interface AssetIssuer {

    void issue(DropCollection collection, ConfirmedMint mint);
}
