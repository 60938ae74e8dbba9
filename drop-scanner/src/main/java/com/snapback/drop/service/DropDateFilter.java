package com.snapback.drop.service;

import com.snapback.drop.model.DropRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Narrows a drop list to one release date.
 *
 * Drops happen early UTC, so the default scan targets tomorrow: probes run
 * the evening before, while the domains are still registered.
 */
@Component
@RequiredArgsConstructor
public class DropDateFilter {

    private final Clock clock;

    public List<DropRecord> selectByDate(List<DropRecord> records, LocalDate targetDate) {
        return records.stream()
                .filter(r -> targetDate.equals(r.getReleaseDate()))
                .toList();
    }

    public LocalDate defaultTargetDate() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).plusDays(1);
    }
}
