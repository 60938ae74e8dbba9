package com.snapback.drop.config;

import lombok.Data;

/**
 * Body of POST /api/scan/start. Every field is optional.
 */
@Data
public class ScanRequest {

    /** YYYY-MM-DD; defaults to tomorrow (UTC) */
    private String date;

    private Boolean checkAvailability;
    private Boolean checkIndex;
    private Boolean filterValuable;
    private Boolean dryRun;
    private Boolean useFallback;
}
