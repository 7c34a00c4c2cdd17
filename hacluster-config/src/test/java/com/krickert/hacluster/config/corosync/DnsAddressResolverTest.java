package com.krickert.hacluster.config.corosync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class DnsAddressResolverTest {

    private DnsAddressResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DnsAddressResolver(CorosyncValidationConfig.builder()
                .withAddressResolutionTimeout(Duration.ofSeconds(2))
                .withAddressResolutionThreads(1)
                .build());
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    @Test
    void literalAddress_isResolvable() {
        assertTrue(resolver.isResolvable("127.0.0.1"));
        assertTrue(resolver.isResolvable("::1"));
    }

    @Test
    void blankName_isNotResolvable() {
        assertFalse(resolver.isResolvable(""));
        assertFalse(resolver.isResolvable(null));
    }

    @Test
    void reservedInvalidDomain_isNotResolvable() {
        assertFalse(resolver.isResolvable("no-such-node.invalid"));
    }

    @Nested
    @DisplayName("with a stubbed lookup")
    class StubbedLookup {

        private final Duration timeout = Duration.ofMillis(300);

        private final CountDownLatch release = new CountDownLatch(1);

        @AfterEach
        void releaseHangingLookups() {
            release.countDown();
        }

        private DnsAddressResolver stubbedResolver(int threads, DnsAddressResolver.HostLookup lookup) {
            return new DnsAddressResolver(CorosyncValidationConfig.builder()
                    .withAddressResolutionTimeout(timeout)
                    .withAddressResolutionThreads(threads)
                    .build(), lookup);
        }

        // ignores interrupts like the system resolver does
        private InetAddress[] hangThenResolve() throws UnknownHostException {
            boolean interrupted = false;
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return new InetAddress[]{InetAddress.getLoopbackAddress()};
        }

        @Test
        void hangingLookup_isUnresolvableAfterTimeout() {
            DnsAddressResolver hanging = stubbedResolver(1, hostName -> hangThenResolve());
            try {
                long started = System.nanoTime();
                boolean resolvable = hanging.isResolvable("slow.example.com");
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

                assertFalse(resolvable, "A lookup exceeding the timeout must count as unresolvable");
                assertTrue(elapsed.compareTo(timeout.minusMillis(50)) >= 0, "Returned too early: " + elapsed);
                assertTrue(elapsed.compareTo(Duration.ofSeconds(5)) < 0, "Waited far beyond the timeout: " + elapsed);
            } finally {
                hanging.close();
            }
        }

        @Test
        void unexpectedLookupFailure_isUnresolvable() {
            DnsAddressResolver failing = stubbedResolver(1, hostName -> {
                throw new IllegalStateException("resolver configuration broken");
            });
            try {
                assertFalse(failing.isResolvable("node1.example.com"));
            } finally {
                failing.close();
            }
        }

        @Test
        void resolvedLookup_isResolvable() {
            DnsAddressResolver resolving = stubbedResolver(1,
                    hostName -> new InetAddress[]{InetAddress.getLoopbackAddress()});
            try {
                assertTrue(resolving.isResolvable("node1.example.com"));
            } finally {
                resolving.close();
            }
        }

        @Test
        void hangingLookup_holdsOnlyItsOwnThread() {
            DnsAddressResolver mixed = stubbedResolver(2, hostName -> hostName.startsWith("slow")
                    ? hangThenResolve()
                    : new InetAddress[]{InetAddress.getLoopbackAddress()});
            try {
                assertFalse(mixed.isResolvable("slow.example.com"));
                assertTrue(mixed.isResolvable("node1.example.com"),
                        "A free pool thread must still serve lookups after another one timed out");
            } finally {
                mixed.close();
            }
        }
    }
}
