package com.flagship.number_gateway.settlement;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface WebhookLogRepository extends JpaRepository<WebhookLogEntity, UUID> {

    Page<WebhookLogEntity> findAllByOrderByReceivedAtDesc(Pageable pageable);

    Page<WebhookLogEntity> findByTxRefOrderByReceivedAtDesc(String txRef, Pageable pageable);

    List<WebhookLogEntity> findByTxRefOrderByReceivedAtAsc(String txRef);

    long countByReceivedAtAfter(Instant since);

    long countByReceivedAtAfterAndSignatureValidFalse(Instant since);

    long countByReceivedAtAfterAndProcessedTrue(Instant since);

    long countByReceivedAtAfterAndAlreadyProcessedTrue(Instant since);

    long countByReceivedAtAfterAndProcessingErrorIsNotNull(Instant since);

    @Query("SELECT AVG(w.processingTimeMs) FROM WebhookLogEntity w WHERE w.receivedAt > :since " +
           "AND w.processingTimeMs IS NOT NULL")
    Double averageProcessingTimeSince(@Param("since") Instant since);
}
