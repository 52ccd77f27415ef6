/* (C)2026 */
package com.ammann.updatetracker.model;

/** Helpers for Docker network modes that share another container's network namespace. */
public final class NetworkModes {

    private static final String CONTAINER_PREFIX = "container:";
    private static final String SERVICE_PREFIX = "service:";
    private static final int SHORT_ID_LENGTH = 12;

    private NetworkModes() {}

    /** Returns whether a network mode joins another container's network namespace. */
    public static boolean isShared(String networkMode) {
        return targetOf(networkMode) != null;
    }

    /**
     * Returns the container or service named by a {@code container:} or {@code service:} mode.
     *
     * @param networkMode the network mode from a host config, possibly {@code null}
     * @return the name or identifier it points at, {@code null} for any other mode
     */
    public static String targetOf(String networkMode) {
        if (networkMode == null) {
            return null;
        }
        if (networkMode.startsWith(CONTAINER_PREFIX)) {
            return networkMode.substring(CONTAINER_PREFIX.length());
        }
        if (networkMode.startsWith(SERVICE_PREFIX)) {
            return networkMode.substring(SERVICE_PREFIX.length());
        }
        return null;
    }

    /**
     * Returns whether a shared network mode points at the given container, by name, full
     * identifier or short identifier.
     */
    public static boolean targets(String networkMode, String containerId, String containerName) {
        String target = targetOf(networkMode);
        if (target == null || target.isEmpty()) {
            return false;
        }
        if (target.equals(containerName) || target.equals(containerId)) {
            return true;
        }
        return containerId != null
                && containerId.length() >= SHORT_ID_LENGTH
                && target.equals(containerId.substring(0, SHORT_ID_LENGTH));
    }

    /** Returns the mode joining the network namespace of the given container. */
    public static String joining(String containerId) {
        return CONTAINER_PREFIX + containerId;
    }
}
