package com.cred.freestyle.mintdrop.infrastructure.ledger;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Local ledger stand-in: fresh pseudo block hashes, every signature reported as confirmed.
 * Active unless mintdrop.ledger.mode=rpc.
 *
 * @author Mint Drop Team
 */
@Component
@ConditionalOnProperty(prefix = "mintdrop.ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockLedgerClient implements LedgerClient {

    @Override
    public String getRecentCheckpoint() {
        byte[] digest = Hash.sha3(UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8));
        return LedgerAddress.encode(digest);
    }

    @Override
    public SignatureStatus getSignatureStatus(String signature) {
        return SignatureStatus.CONFIRMED;
    }
}
