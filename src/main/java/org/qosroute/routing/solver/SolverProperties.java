package org.qosroute.routing.solver;

/**
 * Reads solver defaults from {@code qosroute.<solver>.<field>} system properties.
 * <p>
 * Absent, blank or malformed values fall back to the supplied constant.
 */
public final class SolverProperties {
    public static final String PREFIX = "qosroute.";

    private SolverProperties() {
    }

    public static int readInt(String solver, String field, int fallback) {
        String raw = System.getProperty(key(solver, field));
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    public static double readDouble(String solver, String field, double fallback) {
        String raw = System.getProperty(key(solver, field));
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    public static boolean readBoolean(String solver, String field, boolean fallback) {
        String raw = System.getProperty(key(solver, field));
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(raw.trim());
    }

    /**
     * Reads an optional seed; absent or malformed values yield null.
     */
    public static Long readSeed(String solver) {
        String raw = System.getProperty(key(solver, "seed"));
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static String key(String solver, String field) {
        return PREFIX + solver + "." + field;
    }
}
