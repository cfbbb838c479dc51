package com.demandengine.repository;

import com.demandengine.entity.SeasonalPatternRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface SeasonalPatternRecordRepository extends JpaRepository<SeasonalPatternRecord, UUID> {

    List<SeasonalPatternRecord> findByScopeKeyOrderByPatternTypeAscPeriodIndexAsc(String scopeKey);

    @Modifying
    @Query("DELETE FROM SeasonalPatternRecord p WHERE p.scopeKey = :scopeKey")
    int deleteByScope(@Param("scopeKey") String scopeKey);
}
