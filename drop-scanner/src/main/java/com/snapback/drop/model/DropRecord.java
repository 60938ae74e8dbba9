package com.snapback.drop.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One entry from a namespace's drop list, as published by the registry.
 */
@Value
@Builder
public class DropRecord {

    /** Fully-qualified, lower-cased domain, e.g. "example.se" */
    String name;

    /** UTC calendar date the registry releases the domain */
    LocalDate releaseDate;

    Namespace namespace;
}
