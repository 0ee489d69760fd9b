package com.scidata.dfe.engine;

import java.util.Map;

/**
 * Outcome of a session teardown across its managers.
 *
 * @param sessionId   The session torn down.
 * @param statusCodes Status returned by each manager that answered: 0 for a
 *                    clean teardown, non-zero when nodes were mid-write.
 * @param failures    Error message per manager that could not be reached.
 */
public record TeardownReport(String sessionId, Map<String, Integer> statusCodes, Map<String, String> failures) {

    public TeardownReport {
        statusCodes = Map.copyOf(statusCodes);
        failures = Map.copyOf(failures);
    }

    public static TeardownReport unknown(String sessionId) {
        return new TeardownReport(sessionId, Map.of(), Map.of());
    }

    /** Every manager answered with status 0. */
    public boolean isClean() {
        return failures.isEmpty() && statusCodes.values().stream().allMatch(c -> c == 0);
    }

    /** At least one manager could not be reached. */
    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
