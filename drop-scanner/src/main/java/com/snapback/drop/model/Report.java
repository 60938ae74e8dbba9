package com.snapback.drop.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * An assembled scan report. {@code domains} is already in final order;
 * both output formats render it as-is.
 */
@Value
@JsonPropertyOrder({"generated_at", "total_domains", "domains"})
public class Report {

    @JsonProperty("generated_at")
    String generatedAt;

    @JsonProperty("total_domains")
    int totalDomains;

    @JsonProperty("domains")
    List<ReportRow> domains;
}
