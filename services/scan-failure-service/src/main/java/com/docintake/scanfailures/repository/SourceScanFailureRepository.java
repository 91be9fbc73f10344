package com.docintake.scanfailures.repository;

import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SourceScanFailureRepository extends JpaRepository<SourceScanFailureEntity, UUID> {

    Optional<SourceScanFailureEntity> findByActiveKey(String activeKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from SourceScanFailureEntity f where f.activeKey = :activeKey")
    Optional<SourceScanFailureEntity> findByActiveKeyForUpdate(@Param("activeKey") String activeKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from SourceScanFailureEntity f where f.id = :id")
    Optional<SourceScanFailureEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        select f from SourceScanFailureEntity f
        where (:sourceType is null or f.sourceType = :sourceType)
        order by f.lastFailureAt desc
        """)
    List<SourceScanFailureEntity> findAllBySourceType(@Param("sourceType") SourceType sourceType);

    @Query("""
        select f from SourceScanFailureEntity f
        where f.resolved = false
          and f.userExcluded = false
          and f.nextRetryAt is not null
          and f.nextRetryAt <= :now
          and (:sourceType is null or f.sourceType = :sourceType)
        order by f.nextRetryAt asc
        """)
    List<SourceScanFailureEntity> findRetryCandidates(
        @Param("sourceType") SourceType sourceType,
        @Param("now") Instant now,
        Pageable pageable
    );
}
