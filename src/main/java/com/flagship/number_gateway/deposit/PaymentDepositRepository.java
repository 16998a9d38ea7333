package com.flagship.number_gateway.deposit;

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
public interface PaymentDepositRepository extends JpaRepository<PaymentDepositEntity, UUID> {

    Optional<PaymentDepositEntity> findByTxRef(String txRef);

    Optional<PaymentDepositEntity> findByTxRefAndUserId(String txRef, String userId);

    /**
     * Row lock that serialises concurrent settlements of one reference.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM PaymentDepositEntity d WHERE d.txRef = :txRef")
    Optional<PaymentDepositEntity> findByTxRefForUpdate(@Param("txRef") String txRef);

    Page<PaymentDepositEntity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    List<PaymentDepositEntity> findByStatusAndExpiresAtBefore(DepositStatus status, Instant cutoff, Pageable pageable);

    List<PaymentDepositEntity> findByStatusAndCreatedAtBefore(DepositStatus status, Instant cutoff);

    List<PaymentDepositEntity> findByStatusInAndCreatedAtAfterOrderByCreatedAtAsc(Collection<DepositStatus> statuses,
                                                                               Instant cutoff, Pageable pageable);
}
