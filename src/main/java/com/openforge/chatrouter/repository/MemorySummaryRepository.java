package com.openforge.chatrouter.repository;

import com.openforge.chatrouter.domain.MemorySummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface MemorySummaryRepository extends JpaRepository<MemorySummary, Long> {

    List<MemorySummary> findByOwnerIdAndExpiresAtAfterOrderByPeriodStartDesc(String ownerId, Instant now);

    Optional<MemorySummary> findByOwnerIdAndPeriodAndPeriodStart(String ownerId,
                                                                MemorySummary.Period period,
                                                                Instant periodStart);

    @Modifying
    @Transactional
    @Query("delete from MemorySummary s where s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
