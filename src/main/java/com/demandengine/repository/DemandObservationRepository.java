package com.demandengine.repository;

import com.demandengine.entity.DemandObservationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface DemandObservationRepository extends JpaRepository<DemandObservationRecord, UUID> {

    List<DemandObservationRecord> findByScopeKeyAndObservationDateBetweenOrderByObservationDateAsc(
        String scopeKey, LocalDate from, LocalDate to);
}
