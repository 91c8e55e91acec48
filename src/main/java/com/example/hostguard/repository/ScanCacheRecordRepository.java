package com.example.hostguard.repository;

import com.example.hostguard.domain.ScanCacheRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ScanCacheRecordRepository extends JpaRepository<ScanCacheRecord, String> {

    Optional<ScanCacheRecord> findByHostnameAndCategory(String hostname, String category);

    long deleteByHostname(String hostname);

    long deleteByPurgeAfterBefore(Instant cutoff);
}
