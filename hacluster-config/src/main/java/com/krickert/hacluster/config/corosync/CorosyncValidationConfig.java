package com.krickert.hacluster.config.corosync;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the corosync validators, bound from {@code hacluster.validation}.
 */
@ConfigurationProperties("hacluster.validation")
public class CorosyncValidationConfig {

    /**
     * Default upper bound for a single node address lookup.
     */
    public static final Duration DEFAULT_ADDRESS_RESOLUTION_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Default number of threads running address lookups. A lookup that timed out still holds its thread
     * until the system resolver returns, so this is also the number of hanging names tolerated before
     * resolvable names start timing out behind them.
     */
    public static final int DEFAULT_ADDRESS_RESOLUTION_THREADS = 4;

    public static final boolean DEFAULT_REPORT_ADDRESS_COUNT_MISMATCH = true;

    private Duration addressResolutionTimeout = DEFAULT_ADDRESS_RESOLUTION_TIMEOUT;
    private int addressResolutionThreads = DEFAULT_ADDRESS_RESOLUTION_THREADS;
    private boolean reportAddressCountMismatch = DEFAULT_REPORT_ADDRESS_COUNT_MISMATCH;

    public CorosyncValidationConfig() {
    }

    private CorosyncValidationConfig(Duration addressResolutionTimeout,
                                     int addressResolutionThreads,
                                     boolean reportAddressCountMismatch) {
        this.addressResolutionTimeout = addressResolutionTimeout;
        this.addressResolutionThreads = addressResolutionThreads;
        this.reportAddressCountMismatch = reportAddressCountMismatch;
    }

    public Duration getAddressResolutionTimeout() {
        return addressResolutionTimeout;
    }

    public void setAddressResolutionTimeout(Duration addressResolutionTimeout) {
        this.addressResolutionTimeout = addressResolutionTimeout;
    }

    public int getAddressResolutionThreads() {
        return addressResolutionThreads;
    }

    public void setAddressResolutionThreads(int addressResolutionThreads) {
        this.addressResolutionThreads = addressResolutionThreads;
    }

    /**
     * Whether nodes with differing address counts are reported when creating a cluster.
     */
    public boolean isReportAddressCountMismatch() {
        return reportAddressCountMismatch;
    }

    public void setReportAddressCountMismatch(boolean reportAddressCountMismatch) {
        this.reportAddressCountMismatch = reportAddressCountMismatch;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configurations created outside of the application context.
     */
    public static class Builder {
        private Duration addressResolutionTimeout = DEFAULT_ADDRESS_RESOLUTION_TIMEOUT;
        private int addressResolutionThreads = DEFAULT_ADDRESS_RESOLUTION_THREADS;
        private boolean reportAddressCountMismatch = DEFAULT_REPORT_ADDRESS_COUNT_MISMATCH;

        public Builder withAddressResolutionTimeout(Duration addressResolutionTimeout) {
            this.addressResolutionTimeout = addressResolutionTimeout;
            return this;
        }

        public Builder withAddressResolutionThreads(int addressResolutionThreads) {
            this.addressResolutionThreads = addressResolutionThreads;
            return this;
        }

        public Builder withReportAddressCountMismatch(boolean reportAddressCountMismatch) {
            this.reportAddressCountMismatch = reportAddressCountMismatch;
            return this;
        }

        public CorosyncValidationConfig build() {
            return new CorosyncValidationConfig(addressResolutionTimeout, addressResolutionThreads,
                    reportAddressCountMismatch);
        }
    }
}
