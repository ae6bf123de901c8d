package com.example.dbmonitor.repository;

import com.example.dbmonitor.domain.CriticalQueryEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CriticalQueryEventRepository extends JpaRepository<CriticalQueryEvent, String> {

    List<CriticalQueryEvent> findByTargetIdOrderByDetectedAtDesc(String targetId, Pageable pageable);

    List<CriticalQueryEvent> findByTargetIdAndDetectedAtAfterOrderByDetectedAtDesc(String targetId, Instant since,
                                                                                   Pageable pageable);

    long countByQueryRecordId(String queryRecordId);
}
