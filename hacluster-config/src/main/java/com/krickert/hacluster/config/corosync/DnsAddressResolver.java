package com.krickert.hacluster.config.corosync;

import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves host names through the system resolver. The JDK lookup cannot be interrupted, so it
 * runs on a small daemon pool and the caller waits at most the configured timeout.
 *
 * <p>A lookup that timed out keeps its pool thread until the system resolver gives up. While every
 * thread is held by such a lookup, further names queue up and may time out as well, so the pool
 * size bounds how many hanging names one validation run tolerates.
 */
@Singleton
public class DnsAddressResolver implements AddressResolver, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DnsAddressResolver.class);

    private final Duration timeout;
    private final ExecutorService executor;
    private final HostLookup hostLookup;

    @Inject
    public DnsAddressResolver(CorosyncValidationConfig config) {
        this(config, InetAddress::getAllByName);
    }

    DnsAddressResolver(CorosyncValidationConfig config, HostLookup hostLookup) {
        this.timeout = config.getAddressResolutionTimeout();
        this.hostLookup = hostLookup;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getAddressResolutionThreads()), runnable -> {
            Thread thread = new Thread(runnable, "address-resolver-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        LOG.info("DnsAddressResolver initialized with timeout {} and {} thread(s)",
                timeout, config.getAddressResolutionThreads());
    }

    @Override
    public boolean isResolvable(String hostName) {
        // the JDK resolves an empty name to the loopback address
        if (hostName == null || hostName.isBlank()) {
            return false;
        }
        Future<InetAddress[]> lookup = executor.submit(() -> hostLookup.lookup(hostName));
        try {
            InetAddress[] addresses = lookup.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Address '{}' resolved to {} address(es)", hostName, addresses.length);
            return addresses.length > 0;
        } catch (TimeoutException e) {
            lookup.cancel(true);
            LOG.warn("Resolving address '{}' did not finish within {}, treating it as unresolvable", hostName, timeout);
            return false;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UnknownHostException) {
                LOG.debug("Address '{}' is unknown", hostName);
            } else {
                LOG.warn("Resolving address '{}' failed, treating it as unresolvable", hostName, e.getCause());
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lookup.cancel(true);
            LOG.warn("Interrupted while resolving address '{}', treating it as unresolvable", hostName);
            return false;
        }
    }

    @PreDestroy
    @Override
    public void close() {
        executor.shutdownNow();
    }

    @FunctionalInterface
    interface HostLookup {
        InetAddress[] lookup(String hostName) throws UnknownHostException;
    }
}
