package org.fortranonjava.core;

/**
 * Central constants for the front end.
 */
public final class Configuration {

    public static final String compilerVersion = "1.0.0";

    // Fortran standard the checkers enforce
    public static final String languageStandard = "F2018";

    // Environment flag enabling per-conversion traces from DO loop canonicalization
    public static final String TRACE_CANONICALIZE_ENV = "FORTRAN_TRACE_CANONICALIZE";

    // Prevent instantiation
    private Configuration() {
    }

    public static boolean isTraceEnabled(String envName) {
        return "1".equals(System.getenv(envName));
    }

    public static String getBanner() {
        return "fortranonjava " + compilerVersion + " (" + languageStandard + ")";
    }
}
