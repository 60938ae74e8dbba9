package com.snapback.drop.service.dns;

/**
 * Result of a single name/type lookup.
 */
public enum DnsOutcome {
    /** At least one record of the type came back */
    ANSWER,
    /** The name exists but has no records of this type */
    NO_ANSWER,
    /** NXDOMAIN */
    NXDOMAIN,
    /** The server answered SERVFAIL or gave no usable answer (referral, bad response) */
    NO_NAMESERVERS,
    /** No reply within the resolver timeout */
    TIMEOUT;

    /** Either positive outcome proves the name is in the zone. */
    public boolean provesExistence() {
        return this == ANSWER || this == NO_ANSWER;
    }
}
