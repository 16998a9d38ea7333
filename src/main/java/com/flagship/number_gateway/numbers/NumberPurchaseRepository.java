package com.flagship.number_gateway.numbers;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NumberPurchaseRepository extends JpaRepository<NumberPurchaseEntity, UUID> {

    Optional<NumberPurchaseEntity> findByActivationId(String activationId);

    Optional<NumberPurchaseEntity> findByActivationIdAndUserId(String activationId, String userId);

    /**
     * Locks the purchase row so that concurrent cancel/complete/sync calls serialise.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM NumberPurchaseEntity p WHERE p.activationId = :activationId")
    Optional<NumberPurchaseEntity> findByActivationIdForUpdate(@Param("activationId") String activationId);

    List<NumberPurchaseEntity> findByUserIdAndStatusInOrderByPurchasedAtDesc(String userId,
                                                                             Collection<NumberStatus> statuses);

    Page<NumberPurchaseEntity> findByUserIdOrderByPurchasedAtDesc(String userId, Pageable pageable);

    List<NumberPurchaseEntity> findByStatusAndExpiresAtBefore(NumberStatus status, Instant cutoff, Pageable pageable);

    List<NumberPurchaseEntity> findByStatusInOrderByUpdatedAtAsc(Collection<NumberStatus> statuses, Pageable pageable);
}
