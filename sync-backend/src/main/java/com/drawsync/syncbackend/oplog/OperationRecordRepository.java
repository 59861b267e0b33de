package com.drawsync.syncbackend.oplog;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OperationRecordRepository extends JpaRepository<OperationRecord, Long> {
    List<OperationRecord> findAllByOrderByPositionAsc();
}
