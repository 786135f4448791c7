package io.hookforge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of the process being run. Passed through to callbacks unexamined.
 */
public final class ServiceInfo {

    public static final String ENV_ID = "HOOKFORGE_SERVICE_ID";
    public static final String ENV_NAME = "HOOKFORGE_SERVICE_NAME";
    public static final String ENV_VERSION = "HOOKFORGE_SERVICE_VERSION";
    public static final String ENV_ENDPOINTS = "HOOKFORGE_SERVICE_ENDPOINTS";

    private static final ServiceInfo EMPTY = new ServiceInfo("", "", "", Collections.<String>emptyList());

    private final String id;
    private final String name;
    private final String version;
    private final List<String> endpoints;

    public ServiceInfo(String id, String name, String version, List<String> endpoints) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.version = Objects.requireNonNull(version, "version");
        Objects.requireNonNull(endpoints, "endpoints");
        this.endpoints = Collections.unmodifiableList(new ArrayList<String>(endpoints));
    }

    public static ServiceInfo empty() {
        return EMPTY;
    }

    /**
     * Reads the {@code HOOKFORGE_SERVICE_*} variables; missing ones become empty strings and
     * the endpoint list is split on commas with blank entries dropped.
     */
    public static ServiceInfo fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> endpoints = new ArrayList<String>();
        String rawEndpoints = env.get(ENV_ENDPOINTS);
        if (rawEndpoints != null) {
            for (String endpoint : rawEndpoints.split(",")) {
                String trimmed = endpoint.trim();
                if (!trimmed.isEmpty()) {
                    endpoints.add(trimmed);
                }
            }
        }
        return new ServiceInfo(
            valueOrEmpty(env, ENV_ID),
            valueOrEmpty(env, ENV_NAME),
            valueOrEmpty(env, ENV_VERSION),
            endpoints
        );
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public List<String> endpoints() {
        return endpoints;
    }

    @Override
    public String toString() {
        if (name.isEmpty() && id.isEmpty()) {
            return "<unnamed>";
        }
        StringBuilder builder = new StringBuilder(name.isEmpty() ? id : name);
        if (!version.isEmpty()) {
            builder.append('@').append(version);
        }
        return builder.toString();
    }

    private static String valueOrEmpty(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null ? "" : value.trim();
    }
}
