package com.snapback.drop.model;

/**
 * The two top-level domains published by Internetstiftelsen drop lists.
 * Declaration order is the order namespaces are fetched in.
 */
public enum Namespace {
    SE("se"),
    NU("nu");

    private final String label;

    Namespace(String label) {
        this.label = label;
    }

    /** Lower-case TLD label as it appears in reports, e.g. "se" */
    public String label() {
        return label;
    }
}
