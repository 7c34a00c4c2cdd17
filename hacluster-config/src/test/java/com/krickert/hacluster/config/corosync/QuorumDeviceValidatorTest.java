package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.report.ForceCode;
import com.krickert.hacluster.config.report.ReportCode;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QuorumDeviceValidatorTest {

    private static final List<String> NODE_IDS = List.of("1", "2");

    private final QuorumDeviceValidator validator = new QuorumDeviceValidator();

    private static List<ReportCode> codes(List<ReportItem> reports) {
        return reports.stream().map(ReportItem::code).toList();
    }

    private List<ReportItem> addNet(Map<String, String> modelOptions, boolean forceOptions) {
        return validator.addQuorumDevice("net", modelOptions, Map.of(), Map.of(), NODE_IDS, false, forceOptions);
    }

    @Nested
    @DisplayName("add")
    class Add {

        @Test
        void validDevice_noReports() {
            List<ReportItem> reports = validator.addQuorumDevice("net",
                    Map.of("host", "qnetd.example.com", "algorithm", "ffsplit", "tie_breaker", "2",
                            "connect_timeout", "5000", "force_ip_version", "6", "port", "5403"),
                    Map.of("timeout", "5", "sync_timeout", "10"),
                    Map.of("mode", "on", "interval", "30", "exec_ping", "ping -c 1 127.0.0.1"),
                    NODE_IDS, false, false);

            assertTrue(reports.isEmpty(), "Expected no reports, got: " + reports);
        }

        @Test
        void missingRequiredOptions() {
            List<ReportItem> reports = addNet(Map.of(), false);

            assertEquals(List.of(ReportCode.REQUIRED_OPTION_IS_MISSING, ReportCode.REQUIRED_OPTION_IS_MISSING),
                    codes(reports));
            assertEquals(List.of("algorithm"), reports.get(0).info().get("option_names"));
            assertEquals(List.of("host"), reports.get(1).info().get("option_names"));
            assertEquals("quorum device model", reports.get(0).info().get("option_type"));
        }

        @Test
        void emptyAlgorithm_isNeverForceable() {
            List<ReportItem> reports = addNet(Map.of("host", "h", "algorithm", ""), true);

            assertEquals(1, reports.size());
            assertEquals(ReportCode.INVALID_OPTION_VALUE, reports.get(0).code());
            assertEquals(ReportSeverity.ERROR, reports.get(0).severity());
            assertNull(reports.get(0).forceCode());
            assertEquals(List.of("ffsplit", "lms"), reports.get(0).info().get("allowed_values"));
        }

        @Test
        void unknownAlgorithm_isForceable() {
            ReportItem notForced = addNet(Map.of("host", "h", "algorithm", "2nodelms"), false).get(0);
            ReportItem forced = addNet(Map.of("host", "h", "algorithm", "2nodelms"), true).get(0);

            assertEquals(ForceCode.FORCE_OPTIONS, notForced.forceCode());
            assertEquals(ReportSeverity.WARNING, forced.severity());
        }

        @Test
        void emptyHost_isNotForceable() {
            List<ReportItem> reports = addNet(Map.of("host", "", "algorithm", "lms"), true);

            assertEquals(1, reports.size());
            assertEquals(ReportSeverity.ERROR, reports.get(0).severity());
            assertEquals("host", reports.get(0).info().get("option_name"));
        }

        @Test
        void tieBreaker_withoutNodeIds() {
            List<ReportItem> reports = validator.addQuorumDevice("net",
                    Map.of("host", "h", "algorithm", "lms", "tie_breaker", "1"), Map.of(), Map.of(), null, false, false);

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE), codes(reports));
            assertEquals(List.of("lowest", "highest"), reports.get(0).info().get("allowed_values"));
        }

        @Test
        void tieBreaker_acceptsNodeIds() {
            assertTrue(addNet(Map.of("host", "h", "algorithm", "lms", "tie_breaker", "1"), false).isEmpty());

            List<ReportItem> reports = addNet(Map.of("host", "h", "algorithm", "lms", "tie_breaker", "3"), false);
            assertEquals(List.of("lowest", "highest", "1", "2"), reports.get(0).info().get("allowed_values"));
        }

        @Test
        void outOfRangeValuesAndUnknownNames() {
            List<ReportItem> reports = addNet(Map.of("host", "h", "algorithm", "lms",
                    "connect_timeout", "999", "port", "0", "bogus", "x"), false);

            assertThat(codes(reports)).containsExactly(
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTIONS);
            assertThat(reports).allMatch(report -> report.forceCode() == ForceCode.FORCE_OPTIONS);
        }

        @Test
        void unknownModel_isForceableWithModelCode() {
            List<ReportItem> reports = validator.addQuorumDevice("disk", Map.of("anything", "x"),
                    Map.of(), Map.of(), NODE_IDS, false, false);

            assertEquals(1, reports.size());
            assertEquals("model", reports.get(0).info().get("option_name"));
            assertEquals(ForceCode.FORCE_QDEVICE_MODEL, reports.get(0).forceCode());

            List<ReportItem> forced = validator.addQuorumDevice("disk", Map.of(), Map.of(), Map.of(),
                    NODE_IDS, true, false);
            assertEquals(ReportSeverity.WARNING, forced.get(0).severity());
        }

        @Test
        void modelInGenericOptions_reportedSeparately() {
            List<ReportItem> reports = validator.addQuorumDevice("net", Map.of("host", "h", "algorithm", "lms"),
                    Map.of("model", "net", "bogus", "1", "timeout", "0"), Map.of(), NODE_IDS, false, true);

            assertEquals(3, reports.size());
            assertEquals(ReportSeverity.WARNING, reports.get(0).severity(), "forced timeout value");
            assertEquals(List.of("model"), reports.get(1).info().get("option_names"));
            assertEquals(ReportSeverity.ERROR, reports.get(1).severity());
            assertNull(reports.get(1).forceCode());
            assertEquals(List.of("bogus"), reports.get(2).info().get("option_names"));
            assertEquals(ReportSeverity.WARNING, reports.get(2).severity());
        }

        @Test
        void heuristics_execNamesAreStrict() {
            List<ReportItem> reports = validator.addQuorumDevice("net", Map.of("host", "h", "algorithm", "lms"),
                    Map.of(), Map.of("exec_a.b", "x", "exec_ok", "", "mode", "always", "bogus", "1"),
                    NODE_IDS, false, true);

            assertThat(codes(reports)).containsExactly(
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTIONS,
                    ReportCode.INVALID_USERDEFINED_OPTIONS);
            assertEquals("mode", reports.get(0).info().get("option_name"));
            assertEquals(ReportSeverity.WARNING, reports.get(0).severity());
            assertEquals("exec_ok", reports.get(1).info().get("option_name"));
            assertEquals(ReportSeverity.ERROR, reports.get(1).severity());
            assertEquals(List.of("exec_NAME"), reports.get(2).info().get("allowed_patterns"));
            ReportItem execReport = reports.get(3);
            assertEquals(ReportSeverity.ERROR, execReport.severity());
            assertNull(execReport.forceCode());
            assertEquals(List.of("exec_a.b"), execReport.info().get("option_names"));
        }

        @Test
        void heuristics_execNameWithWhitespace() {
            List<ReportItem> reports = validator.addQuorumDevice("net", Map.of("host", "h", "algorithm", "lms"),
                    Map.of(), Map.of("exec_a b", "x", "exec_", "y"), NODE_IDS, false, false);

            assertEquals(List.of(ReportCode.INVALID_USERDEFINED_OPTIONS), codes(reports));
            assertEquals(List.of("exec_", "exec_a b"), reports.get(0).info().get("option_names"));
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void requiredOptionsNotNeeded_emptyValuesUnset() {
            List<ReportItem> reports = validator.updateQuorumDevice("net",
                    Map.of("port", "", "tie_breaker", ""),
                    Map.of("timeout", ""),
                    Map.of("mode", "", "exec_ping", ""),
                    NODE_IDS, false);

            assertTrue(reports.isEmpty(), "Expected no reports, got: " + reports);
        }

        @Test
        void emptyHostAndAlgorithm_stillInvalid() {
            List<ReportItem> reports = validator.updateQuorumDevice("net",
                    Map.of("host", "", "algorithm", ""), Map.of(), Map.of(), NODE_IDS, false);

            assertEquals(List.of(ReportCode.INVALID_OPTION_VALUE, ReportCode.INVALID_OPTION_VALUE), codes(reports));
        }

        @Test
        void unknownModel_optionsNotChecked() {
            assertTrue(validator.updateQuorumDevice("disk", Map.of("bogus", "x"), Map.of(), Map.of(),
                    NODE_IDS, false).isEmpty());
        }

        @Test
        void invalidValuesStillReported() {
            List<ReportItem> reports = validator.updateQuorumDevice("net",
                    Map.of("connect_timeout", "500000"), Map.of("sync_timeout", "-1"),
                    Map.of("interval", "x", "exec_x:y", ""), NODE_IDS, false);

            assertThat(codes(reports)).containsExactly(
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_OPTION_VALUE,
                    ReportCode.INVALID_USERDEFINED_OPTIONS);
        }
    }
}
