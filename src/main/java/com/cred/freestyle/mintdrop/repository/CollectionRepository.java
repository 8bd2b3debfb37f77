package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.DropCollection;
import com.cred.freestyle.mintdrop.domain.model.DropCollection.CollectionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for DropCollection entity operations.
 *
 * @author Mint Drop Team
 */
@Repository
public interface CollectionRepository extends JpaRepository<DropCollection, String> {

    Optional<DropCollection> findByCollectionAddress(String collectionAddress);

    List<DropCollection> findByStatus(CollectionStatus status);

    /**
     * Find a collection with a pessimistic write lock (SELECT ... FOR UPDATE).
     * Serializes item claims and per-wallet limit checks within one collection.
     *
     * @param collectionId Collection ID
     * @return Optional containing the locked collection
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM DropCollection c WHERE c.collectionId = :collectionId")
    Optional<DropCollection> findByIdWithLock(@Param("collectionId") String collectionId);

    @Modifying
    @Query("UPDATE DropCollection c SET c.mintedCount = :mintedCount, c.mintedCountRefreshedAt = :refreshedAt " +
           "WHERE c.collectionId = :collectionId")
    int updateMintedCount(@Param("collectionId") String collectionId,
                          @Param("mintedCount") Integer mintedCount,
                          @Param("refreshedAt") Instant refreshedAt);

    /**
     * Move a collection from one status to another. No-op if it is no longer in the expected status.
     */
    @Modifying
    @Query("UPDATE DropCollection c SET c.status = :newStatus " +
           "WHERE c.collectionId = :collectionId AND c.status = :expectedStatus")
    int transitionStatus(@Param("collectionId") String collectionId,
                         @Param("expectedStatus") CollectionStatus expectedStatus,
                         @Param("newStatus") CollectionStatus newStatus);
}
