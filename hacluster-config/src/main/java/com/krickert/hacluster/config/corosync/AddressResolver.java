package com.krickert.hacluster.config.corosync;

/**
 * Name resolution used to check node addresses which are not IP literals.
 */
@FunctionalInterface
public interface AddressResolver {
    /**
     * @return true if the host name resolves to at least one address. Failures and timeouts yield false.
     */
    boolean isResolvable(String hostName);
}
