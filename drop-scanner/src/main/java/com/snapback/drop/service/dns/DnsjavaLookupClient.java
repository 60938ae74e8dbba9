package com.snapback.drop.service.dns;

import com.snapback.drop.config.DropScannerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.UnknownHostException;

/**
 * dnsjava-backed lookups with a single resolver, bounded timeout, no retries
 * and no caching between calls.
 */
@Component
@Slf4j
public class DnsjavaLookupClient implements DnsLookupClient {

    private static final String SERVFAIL = Rcode.string(Rcode.SERVFAIL);

    private final Resolver resolver;

    @Autowired
    public DnsjavaLookupClient(DropScannerProperties properties) throws UnknownHostException {
        this(createResolver(properties.getDns()));
    }

    DnsjavaLookupClient(Resolver resolver) {
        this.resolver = resolver;
    }

    private static Resolver createResolver(DropScannerProperties.Dns dns) throws UnknownHostException {
        Resolver resolver = dns.getServer() == null || dns.getServer().isBlank()
                ? new SimpleResolver()
                : new SimpleResolver(dns.getServer());
        resolver.setTimeout(dns.getTimeout());
        return resolver;
    }

    @Override
    public DnsOutcome lookup(String domain, String recordType) {
        int type = Type.value(recordType);
        if (type < 0) {
            throw new IllegalArgumentException("Unknown DNS record type: " + recordType);
        }

        Lookup lookup;
        try {
            lookup = new Lookup(Name.fromString(domain, Name.root), type);
        } catch (TextParseException e) {
            log.debug("Unparseable domain {}: {}", domain, e.getMessage());
            return DnsOutcome.NXDOMAIN;
        }
        lookup.setResolver(resolver);
        lookup.setCache(null);
        lookup.run();

        return switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL -> DnsOutcome.ANSWER;
            case Lookup.TYPE_NOT_FOUND -> DnsOutcome.NO_ANSWER;
            case Lookup.HOST_NOT_FOUND -> DnsOutcome.NXDOMAIN;
            // dnsjava reports both SERVFAIL and an unanswered query as TRY_AGAIN
            case Lookup.TRY_AGAIN -> SERVFAIL.equals(lookup.getErrorString())
                    ? DnsOutcome.NO_NAMESERVERS
                    : DnsOutcome.TIMEOUT;
            default -> DnsOutcome.NO_NAMESERVERS;
        };
    }
}
