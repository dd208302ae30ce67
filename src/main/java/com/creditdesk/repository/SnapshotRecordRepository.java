package com.creditdesk.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SnapshotRecordRepository extends JpaRepository<SnapshotRecord, String> {
}
