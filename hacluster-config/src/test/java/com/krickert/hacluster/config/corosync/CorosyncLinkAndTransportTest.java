package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.report.ReportCode;
import com.krickert.hacluster.config.report.ReportItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorosyncLinkAndTransportTest {

    private final CorosyncConfigValidator validator = new CorosyncConfigValidator(
            hostName -> true, CorosyncValidationConfig.builder().build());

    private static List<ReportCode> codes(List<ReportItem> reports) {
        return reports.stream().map(ReportItem::code).toList();
    }

    @Nested
    @DisplayName("knet links")
    class KnetLinks {

        @Test
        void duplicateLinkNumber_reportedOnce() {
            List<ReportItem> reports = validator.createLinkListKnet(List.of(
                    Map.of("linknumber", "0"),
                    Map.of("linknumber", "0")), 7);

            assertEquals(1, reports.size(), "Expected a single report, got: " + reports);
            assertEquals(ReportCode.COROSYNC_LINK_NUMBER_DUPLICATION, reports.get(0).code());
            assertEquals(List.of("0"), reports.get(0).info().get("link_number_list"));
        }

        @Test
        void linkNumber_boundedByMaxLinkNumber() {
            List<ReportItem> reports = validator.createLinkListKnet(List.of(Map.of("linknumber", "3")), 2);

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE), codes(reports));
            assertEquals("0..2", reports.get(0).info().get("allowed_values"));
        }

        @Test
        void linkNumber_maxLinkNumberCappedByKnetLimit() {
            List<ReportItem> reports = validator.createLinkListKnet(List.of(Map.of("linknumber", "8")), 20);

            assertEquals("0..7", reports.get(0).info().get("allowed_values"));
        }

        @Test
        void linkNumber_negativeMaxLinkNumberAllowsZeroOnly() {
            assertTrue(validator.createLinkListKnet(List.of(Map.of("linknumber", "0")), -1).isEmpty());
            assertEquals(1, validator.createLinkListKnet(List.of(Map.of("linknumber", "1")), -1).size());
        }

        @Test
        void pingIntervalAndTimeout_dependOnEachOther() {
            List<ReportItem> reports = validator.createLinkListKnet(List.of(
                    Map.of("ping_interval", "100"),
                    Map.of("ping_timeout", "200"),
                    Map.of("ping_interval", "100", "ping_timeout", "200")), 7);

            assertEquals(List.of(ReportCode.PREREQUISITE_OPTION_IS_MISSING, ReportCode.PREREQUISITE_OPTION_IS_MISSING),
                    codes(reports));
            assertEquals("ping_timeout", reports.get(0).info().get("prerequisite_name"));
            assertEquals("ping_interval", reports.get(1).info().get("prerequisite_name"));
        }

        @Test
        void invalidValuesAndNames() {
            List<ReportItem> reports = validator.createLinkListKnet(List.of(Map.of(
                    "transport", "tcp",
                    "link_priority", "256",
                    "bindnetaddr", "10.0.0.0")), 7);

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE, ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTIONS), codes(reports));
            assertEquals(List.of("bindnetaddr"), reports.get(2).info().get("option_names"));
            assertNull(reports.get(2).forceCode(), "link option names cannot be forced");
        }

        @Test
        void tooManyLinks() {
            List<Map<String, String>> links = Collections.nCopies(9, Map.<String, String>of());

            List<ReportItem> reports = validator.createLinkListKnet(links, 7);

            assertEquals(List.of(ReportCode.COROSYNC_TOO_MANY_LINKS), codes(reports));
            assertEquals(9, reports.get(0).info().get("actual_count"));
            assertEquals(8, reports.get(0).info().get("max_count"));
        }

        @Test
        void noLinks_noReports() {
            assertTrue(validator.createLinkListKnet(List.of(), 7).isEmpty());
        }
    }

    @Nested
    @DisplayName("udp links")
    class UdpLinks {

        @Test
        void validLink() {
            assertTrue(validator.createLinkListUdp(List.of(Map.of(
                    "bindnetaddr", "10.0.0.0",
                    "mcastaddr", "239.255.1.1",
                    "mcastport", "5405",
                    "ttl", "1"))).isEmpty());
        }

        @Test
        void scopedIpv6Bindnetaddr_isInvalid() {
            List<ReportItem> reports = validator.createLinkListUdp(List.of(Map.of("bindnetaddr", "fe80::1%eth0")));

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE), codes(reports));
            assertEquals("bindnetaddr", reports.get(0).info().get("option_name"));
        }

        @Test
        void broadcastWithMcastaddr_isContradictory() {
            List<ReportItem> reports = validator.createLinkListUdp(List.of(Map.of(
                    "broadcast", "1",
                    "mcastaddr", "239.255.1.1")));

            assertEquals(List.of(ReportCode.COROSYNC_BROADCAST_DISALLOWS_MCASTADDR), codes(reports));
        }

        @Test
        void broadcastDisabledWithMcastaddr_isFine() {
            assertTrue(validator.createLinkListUdp(List.of(Map.of(
                    "broadcast", "0",
                    "mcastaddr", "239.255.1.1"))).isEmpty());
        }

        @Test
        void moreThanOneLink() {
            List<ReportItem> reports = validator.createLinkListUdp(List.of(Map.of(), Map.of()));

            assertEquals(List.of(ReportCode.COROSYNC_TOO_MANY_LINKS), codes(reports));
            assertEquals("udp/udpu", reports.get(0).info().get("transport"));
        }

        @Test
        void invalidValuesAndUnknownName() {
            List<ReportItem> reports = validator.createLinkListUdp(List.of(Map.of(
                    "ttl", "300",
                    "linknumber", "0")));

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE, ReportCode.INVALID_OPTIONS), codes(reports));
        }
    }

    @Nested
    @DisplayName("transport and totem")
    class TransportAndTotem {

        @Test
        void udpTransport() {
            assertTrue(validator.createTransportUdp(Map.of("ip_version", "ipv6", "netmtu", "1500")).isEmpty());
            List<ReportItem> reports = validator.createTransportUdp(Map.of("netmtu", "0", "link_mode", "rr"));
            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE, ReportCode.INVALID_OPTIONS), codes(reports));
            assertEquals("udp/udpu transport", reports.get(1).info().get("option_type"));
        }

        @Test
        void knetTransport_groupsHaveOwnNameChecks() {
            List<ReportItem> reports = validator.createTransportKnet(
                    Map.of("link_mode", "passive", "netmtu", "1500"),
                    Map.of("model", "zlib", "speed", "fast"),
                    Map.of("cipher", "aes128", "hash", "sha256", "key", "x"));

            assertEquals(List.of(ReportCode.INVALID_OPTIONS, ReportCode.INVALID_OPTIONS, ReportCode.INVALID_OPTIONS),
                    codes(reports));
            assertEquals("transport", reports.get(0).info().get("option_type"));
            assertEquals("compression", reports.get(1).info().get("option_type"));
            assertEquals("crypto", reports.get(2).info().get("option_type"));
        }

        @Test
        void knetTransport_cipherWithoutHash() {
            assertEquals(List.of(ReportCode.COROSYNC_CRYPTO_CIPHER_REQUIRES_CRYPTO_HASH),
                    codes(validator.createTransportKnet(Map.of(), Map.of(), Map.of("hash", "none"))));
            assertEquals(List.of(ReportCode.COROSYNC_CRYPTO_CIPHER_REQUIRES_CRYPTO_HASH),
                    codes(validator.createTransportKnet(Map.of(), Map.of(), Map.of("cipher", "aes256", "hash", "none"))));
            assertTrue(validator.createTransportKnet(Map.of(), Map.of(), Map.of("cipher", "none", "hash", "none")).isEmpty());
            assertTrue(validator.createTransportKnet(Map.of()).isEmpty());
        }

        @Test
        void knetTransport_missingOptionGroups() {
            assertTrue(validator.createTransportKnet(null, null, null).isEmpty());
            assertTrue(validator.createTransportUdp(null).isEmpty());
        }

        @Test
        void knetTransport_invalidValues() {
            List<ReportItem> reports = validator.createTransportKnet(
                    Map.of("knet_pmtud_interval", "-1"),
                    Map.of("level", ""),
                    Map.of("model", "gnutls"));

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE, ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTION_VALUE), codes(reports));
        }

        @Test
        void totem_nonNegativeIntegersOnly() {
            assertTrue(validator.createTotem(Map.of("token", "3000", "join", "0")).isEmpty());

            List<ReportItem> reports = validator.createTotem(Map.of("token", "-1", "tokens", "1"));

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE, ReportCode.INVALID_OPTIONS), codes(reports));
            assertEquals("totem", reports.get(1).info().get("option_type"));
            assertNull(reports.get(1).forceCode());
        }
    }
}
