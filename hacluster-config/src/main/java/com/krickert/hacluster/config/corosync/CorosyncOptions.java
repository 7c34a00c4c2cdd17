package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.validation.OptionNamePattern;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Option names and value sets of corosync.conf sections.
 */
final class CorosyncOptions {

    private CorosyncOptions() {
    }

    static final List<String> BOOLEAN_VALUES = List.of("0", "1");
    static final List<String> IP_VERSIONS = List.of("ipv4", "ipv6");

    static final List<String> LINK_UDP_OPTIONS = List.of(
            "bindnetaddr", "broadcast", "mcastaddr", "mcastport", "ttl");

    static final List<String> LINK_KNET_OPTIONS = List.of(
            "ip_version", "linknumber", "link_priority", "mcastport", "ping_interval", "ping_precision",
            "ping_timeout", "pong_count", "transport");

    static final List<String> TRANSPORT_UDP_OPTIONS = List.of("ip_version", "netmtu");

    static final List<String> TRANSPORT_KNET_OPTIONS = List.of("ip_version", "knet_pmtud_interval", "link_mode");
    static final List<String> COMPRESSION_OPTIONS = List.of("level", "model", "threshold");
    static final List<String> CRYPTO_OPTIONS = List.of("cipher", "hash", "model");
    static final List<String> CRYPTO_CIPHERS = List.of("none", "aes256", "aes192", "aes128", "3des");
    static final List<String> CRYPTO_HASHES = List.of("none", "md5", "sha1", "sha256", "sha384", "sha512");
    static final String DEFAULT_CRYPTO_CIPHER = "aes256";
    static final String DEFAULT_CRYPTO_HASH = "sha1";

    static final List<String> TOTEM_OPTIONS = List.of(
            "consensus", "downcheck", "fail_recv_const", "heartbeat_failures_allowed", "hold", "join",
            "max_messages", "max_network_delay", "merge", "miss_count_const", "send_join",
            "seqno_unchanged_const", "token", "token_coefficient", "token_retransmit",
            "token_retransmits_before_loss_const", "window_size");

    static final List<String> QUORUM_OPTIONS = List.of(
            "auto_tie_breaker", "last_man_standing", "last_man_standing_window", "wait_for_all");
    static final List<String> QUORUM_OPTIONS_INCOMPATIBLE_WITH_QDEVICE = List.of(
            "auto_tie_breaker", "last_man_standing", "last_man_standing_window");

    static final List<String> QDEVICE_NET_REQUIRED_OPTIONS = List.of("algorithm", "host");
    static final List<String> QDEVICE_NET_OPTIONAL_OPTIONS = List.of(
            "connect_timeout", "force_ip_version", "port", "tie_breaker");
    static final List<String> QDEVICE_NET_ALGORITHMS = List.of("ffsplit", "lms");
    static final List<String> QDEVICE_NET_TIE_BREAKERS = List.of("lowest", "highest");
    static final List<String> QDEVICE_GENERIC_OPTIONS = List.of("sync_timeout", "timeout");
    static final String QDEVICE_MODEL_OPTION = "model";

    static final List<String> HEURISTICS_OPTIONS = List.of("interval", "mode", "sync_timeout", "timeout");
    static final List<String> HEURISTICS_MODES = List.of("off", "on", "sync");
    static final String HEURISTICS_EXEC_PREFIX = "exec_";
    static final OptionNamePattern HEURISTICS_EXEC_PATTERN =
            OptionNamePattern.prefixed(HEURISTICS_EXEC_PREFIX, "exec_NAME");
    // exec_NAME ends up as a corosync.conf key, so it must not be able to open a new section or key
    static final Pattern HEURISTICS_EXEC_NAME = Pattern.compile("^exec_[^.:{}#\\s]+$");
}
