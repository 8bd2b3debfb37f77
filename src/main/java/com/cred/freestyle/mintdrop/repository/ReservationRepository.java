package com.cred.freestyle.mintdrop.repository;

import com.cred.freestyle.mintdrop.domain.model.Reservation;
import com.cred.freestyle.mintdrop.domain.model.Reservation.ReservationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Reservation entity operations.
 *
 * @author Mint Drop Team
 */
@Repository
public interface ReservationRepository extends JpaRepository<Reservation, String> {

    /**
     * Find reservation by idempotency key.
     * Used for at-most-once semantics on retried reserve requests.
     *
     * @param idempotencyKey Client-supplied idempotency key
     * @return Optional containing the reservation if found
     */
    Optional<Reservation> findByIdempotencyKey(String idempotencyKey);

    /**
     * Find reservation by idempotency key with a row lock.
     * Confirm and expire both take this lock so they never interleave on the same reservation.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.idempotencyKey = :idempotencyKey")
    Optional<Reservation> findByIdempotencyKeyForUpdate(@Param("idempotencyKey") String idempotencyKey);

    /**
     * Keys of reservations in the given statuses whose expiry has passed, oldest first.
     */
    @Query("SELECT r.idempotencyKey FROM Reservation r " +
           "WHERE r.status IN :statuses AND r.expiresAt <= :now ORDER BY r.expiresAt")
    List<String> findExpiredKeys(@Param("statuses") Collection<ReservationStatus> statuses,
                                 @Param("now") Instant now,
                                 Pageable pageable);

    /**
     * Total quantity a wallet holds in a phase across the given statuses.
     */
    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM Reservation r " +
           "WHERE r.wallet = :wallet AND r.phaseId = :phaseId AND r.status IN :statuses")
    long sumQuantityByWalletAndPhase(@Param("wallet") String wallet,
                                     @Param("phaseId") String phaseId,
                                     @Param("statuses") Collection<ReservationStatus> statuses);
}
