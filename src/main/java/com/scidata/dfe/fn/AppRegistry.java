package com.scidata.dfe.fn;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.exception.GraphConstructionException;
import com.scidata.dfe.fn.apps.CrcResult;
import com.scidata.dfe.fn.apps.Grep;
import com.scidata.dfe.fn.apps.ReverseTokens;
import com.scidata.dfe.fn.apps.SortLines;
import com.scidata.dfe.fn.apps.SumContainerChecksums;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry mapping application names, as used in pipeline definitions, to
 * factories of {@link AppLogic}.
 *
 * Each factory receives the stage's properties map and returns a fresh logic
 * instance per consumer node.
 */
public final class AppRegistry {
    public static final String CRC = "crc";
    public static final String GREP = "grep";
    public static final String SORT_LINES = "sort-lines";
    public static final String REVERSE_TOKENS = "reverse-tokens";
    public static final String SUM_CHECKSUMS = "sum-checksums";

    private final Map<String, Function<Map<String, Object>, AppLogic>> factories = new ConcurrentHashMap<>();

    public AppRegistry() {
        registerBuiltIns();
    }

    public AppRegistry register(String name, Function<Map<String, Object>, AppLogic> factory) {
        factories.put(name, factory);
        return this;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * Creates a logic instance.
     *
     * @throws GraphConstructionException if no application is registered under
     *                                    the name.
     */
    public AppLogic create(String name, Map<String, Object> properties) {
        Function<Map<String, Object>, AppLogic> factory = name == null ? null : factories.get(name);
        if (factory == null)
            throw new GraphConstructionException("Unknown application: " + name);
        return factory.apply(properties != null ? properties : Map.of());
    }

    // ── Built-in Applications ───────────────────────────────────

    private void registerBuiltIns() {
        register(CRC, p -> new CrcResult());
        register(GREP, p -> new Grep(requireString(p, "substring", GREP)));
        register(SORT_LINES, p -> new SortLines(getBoolean(p, "descending", false)));
        register(REVERSE_TOKENS, p -> new ReverseTokens());
        register(SUM_CHECKSUMS, p -> new SumContainerChecksums());
    }

    static String requireString(Map<String, Object> props, String key, String app) {
        Object v = props.get(key);
        if (v == null)
            throw new GraphConstructionException("Application " + app + " needs property '" + key + "'");
        return v.toString();
    }

    static boolean getBoolean(Map<String, Object> props, String key, boolean def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
    }
}
