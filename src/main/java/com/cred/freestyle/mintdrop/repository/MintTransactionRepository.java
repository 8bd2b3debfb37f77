package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.MintTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the append-only mint transaction log.
 *
 * @author Mint Drop Team
 */
@Repository
public interface MintTransactionRepository extends JpaRepository<MintTransaction, String> {

    Optional<MintTransaction> findByTransactionSignature(String transactionSignature);
}
