package com.proxylens.report;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.IocSet;
import com.proxylens.normalization.FieldValues;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Collects indicators of compromise from findings and their linked events.
 */
@Component
public class IocExtractor {

    public IocSet extract(List<Finding> findings, Collection<Event> linkedEvents) {
        IocSet iocs = new IocSet();

        for (Finding finding : findings) {
            finding.evidenceString(EvidenceKeys.USER_EMAIL).ifPresent(iocs.getUsers()::add);
            finding.evidenceString(EvidenceKeys.CLIENT_IP).ifPresent(ip -> addIp(iocs, ip));
            finding.evidenceString(EvidenceKeys.DEST_HOST).ifPresent(host -> addHost(iocs, host));
            for (String host : finding.evidenceList("dest_hosts_sample")) {
                addHost(iocs, host);
            }
            for (String url : finding.evidenceList(EvidenceKeys.URLS)) {
                addUrl(iocs, url);
            }
        }

        for (Event event : linkedEvents) {
            event.getUserEmail().ifPresent(iocs.getUsers()::add);
            event.getClientIp().ifPresent(ip -> addIp(iocs, ip));
            event.getServerIp().ifPresent(ip -> addIp(iocs, ip));
            event.getDestHost().ifPresent(host -> addHost(iocs, host));
            event.getUrl().ifPresent(url -> addUrl(iocs, url));
        }
        return iocs;
    }

    private static void addIp(IocSet iocs, String ip) {
        if (InetAddresses.isInetAddress(ip)) {
            iocs.getIps().add(ip);
        }
    }

    /**
     * Hosts that are IP literals count as IPs; otherwise only public-style domain names are kept
     */
    private static void addHost(IocSet iocs, String host) {
        String candidate = host.trim().toLowerCase(Locale.ROOT);
        if (InetAddresses.isInetAddress(candidate)) {
            iocs.getIps().add(candidate);
        } else if (isPublicDomain(candidate)) {
            iocs.getDomains().add(candidate);
        }
    }

    private static void addUrl(IocSet iocs, String url) {
        iocs.getUrls().add(url);
        String host = FieldValues.hostFromUrl(url);
        if (host != null) {
            addHost(iocs, host);
        }
    }

    static boolean isPublicDomain(String host) {
        if (host.isEmpty() || !InternetDomainName.isValid(host)) {
            return false;
        }
        InternetDomainName name = InternetDomainName.from(host);
        return name.hasPublicSuffix() && !name.isPublicSuffix();
    }
}
