package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.MintPhase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for MintPhase entity operations.
 *
 * @author Mint Drop Team
 */
@Repository
public interface MintPhaseRepository extends JpaRepository<MintPhase, String> {

    List<MintPhase> findByCollectionIdOrderByStartTimeAsc(String collectionId);
}
