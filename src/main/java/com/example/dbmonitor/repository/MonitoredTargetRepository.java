package com.example.dbmonitor.repository;

import com.example.dbmonitor.domain.MonitoredTarget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MonitoredTargetRepository extends JpaRepository<MonitoredTarget, String> {

    List<MonitoredTarget> findByMonitoringEnabled(boolean monitoringEnabled);

    List<MonitoredTarget> findByOwnerId(String ownerId);
}
