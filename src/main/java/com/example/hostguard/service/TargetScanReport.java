package com.example.hostguard.service;

import com.example.hostguard.registry.HostValidationResult;
import com.example.hostguard.scan.ScanResult;
import lombok.Builder;
import lombok.Value;

/**
 * Validation outcome for a requested target plus, when the target was real,
 * the scan result. Invalid targets are never scanned, so {@code scan} is null.
 */
@Value
@Builder
public class TargetScanReport {

    String query;
    HostValidationResult validation;
    ScanResult scan;

    public boolean isScanned() {
        return scan != null;
    }

    public boolean isSuccess() {
        return scan != null && scan.isSuccess();
    }

    public static TargetScanReport rejected(String query, HostValidationResult validation) {
        return TargetScanReport.builder().query(query).validation(validation).build();
    }
}
