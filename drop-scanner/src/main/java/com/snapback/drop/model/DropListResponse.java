package com.snapback.drop.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the bardate_domains JSON feed.
 * Kept separate from {@link DropRecord} to isolate feed coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DropListResponse {

    private List<Entry> data = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String name;

        @JsonProperty("release_at")
        private String releaseAt;
    }
}
