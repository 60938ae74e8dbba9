package com.snapback.drop.service.dns;

public interface DnsLookupClient {

    /**
     * Look up one record type for a domain. Never throws; failures map to an outcome.
     *
     * @param domain     e.g. "example.se"
     * @param recordType mnemonic such as "A" or "MX"
     */
    DnsOutcome lookup(String domain, String recordType);
}
