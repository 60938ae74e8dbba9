package com.snapback.drop.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical output record. CSV columns and JSON fields share this field set and order.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"domain", "tld", "release_date", "available", "indexed",
        "estimated_pages", "index_source", "checked_at"})
public class ReportRow {

    @JsonProperty("domain")
    String domain;

    @JsonProperty("tld")
    String tld;

    /** ISO YYYY-MM-DD */
    @JsonProperty("release_date")
    String releaseDate;

    @JsonProperty("available")
    Availability available;

    @JsonProperty("indexed")
    IndexPresence indexed;

    @JsonProperty("estimated_pages")
    Integer estimatedPages;

    @JsonProperty("index_source")
    String indexSource;

    /** ISO-8601 instant */
    @JsonProperty("checked_at")
    String checkedAt;

    /** Sort weight: a missing count ranks as zero. */
    public int pagesOrZero() {
        return estimatedPages == null ? 0 : estimatedPages;
    }
}
