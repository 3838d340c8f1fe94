package com.elara.kconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * KconfigEnvironment
 *
 * Immutable snapshot of the process-level settings a Kconfig load depends on.
 * Passed to {@link Kconfig#load} so parsing never reads ambient process state.
 *
 * Recognized variables:
 * - srctree     fallback directory for relative Kconfig and .config paths
 * - CONFIG_     prefix of symbol names in .config files (default "CONFIG_")
 *
 * All variables are also visible to 'option env=' and to $NAME expansion.
 */
public final class KconfigEnvironment {

    public static final String DEFAULT_CONFIG_PREFIX = "CONFIG_";

    private final Map<String, String> vars;
    private final String unameRelease;

    private KconfigEnvironment(Map<String, String> vars, String unameRelease) {
        this.vars = Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        this.unameRelease = unameRelease;
    }

    /** Snapshot of {@link System#getenv()}, with the JVM's OS version as uname release. */
    public static KconfigEnvironment fromSystem() {
        return new KconfigEnvironment(System.getenv(), System.getProperty("os.version", ""));
    }

    /** An environment holding exactly {@code vars}. */
    public static KconfigEnvironment of(Map<String, String> vars) {
        return new KconfigEnvironment(vars == null ? Collections.emptyMap() : vars,
                System.getProperty("os.version", ""));
    }

    /** An empty environment. */
    public static KconfigEnvironment empty() {
        return of(Collections.emptyMap());
    }

    /** Copy with {@code name} set to {@code value} (removed if value is null). */
    public KconfigEnvironment with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(vars);
        if (value == null) copy.remove(name);
        else copy.put(name, value);
        return new KconfigEnvironment(copy, unameRelease);
    }

    /** Copy with a different uname release string. */
    public KconfigEnvironment withUnameRelease(String release) {
        return new KconfigEnvironment(vars, release == null ? "" : release);
    }

    /** Value of the variable, or null if unset. */
    public String get(String name) {
        return vars.get(name);
    }

    public boolean contains(String name) {
        return vars.containsKey(name);
    }

    public Map<String, String> getVariables() {
        return vars;
    }

    /** The srctree directory, or null. */
    public String getSrctree() {
        return vars.get("srctree");
    }

    public String getConfigPrefix() {
        String p = vars.get("CONFIG_");
        return p == null ? DEFAULT_CONFIG_PREFIX : p;
    }

    public String getUnameRelease() {
        return unameRelease;
    }
}
