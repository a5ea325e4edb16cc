package com.mwpbound.analyzer.config;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Deserialized form of an analysis configuration file.
 */
public class AnalysisConfig {

    static final List<Integer> DEFAULT_DOMAIN = List.of(0, 1, 2);

    @SerializedName("mode")
    private AnalysisMode mode;

    /** Run every function to completion, even after it is known to have no bound (default: false). */
    @SerializedName("fin")
    private Boolean fin;

    /** Skip functions with unsupported syntax instead of removing the offending statements (default: false). */
    @SerializedName("strict")
    private Boolean strict;

    /** Rule variants at each choice point: a non-empty subset of [0, 1, 2] (default: all three). */
    @SerializedName("domain")
    private List<Integer> domain;

    @SerializedName("verbose")
    private Boolean verbose;

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public AnalysisMode getMode()     { return mode != null ? mode : AnalysisMode.FUNCTION; }
    public boolean isFin()            { return fin != null && fin; }
    public boolean isStrict()         { return strict != null && strict; }
    public List<Integer> getDomain()  { return domain != null ? checkDomain(domain) : DEFAULT_DOMAIN; }
    public boolean isVerbose()        { return verbose != null && verbose; }

    public AnalysisConfig withMode(AnalysisMode mode) {
        AnalysisConfig copy = copy();
        copy.mode = mode;
        return copy;
    }

    public AnalysisConfig withFin(boolean fin) {
        AnalysisConfig copy = copy();
        copy.fin = fin;
        return copy;
    }

    public AnalysisConfig withStrict(boolean strict) {
        AnalysisConfig copy = copy();
        copy.strict = strict;
        return copy;
    }

    public AnalysisConfig withVerbose(boolean verbose) {
        AnalysisConfig copy = copy();
        copy.verbose = verbose;
        return copy;
    }

    /**
     * The rule table only produces the variants 0, 1 and 2, so any other value would hide
     * every infinite flow.
     *
     * @throws IllegalArgumentException if {@code domain} is empty, has a null or a value outside [0, 1, 2]
     */
    static List<Integer> checkDomain(List<Integer> domain) {
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("domain must not be empty");
        }
        for (Integer value : domain) {
            if (value == null || !DEFAULT_DOMAIN.contains(value)) {
                throw new IllegalArgumentException("domain values must be in " + DEFAULT_DOMAIN + ", got " + domain);
            }
        }
        return List.copyOf(domain);
    }

    private AnalysisConfig copy() {
        AnalysisConfig copy = new AnalysisConfig();
        copy.mode = mode;
        copy.fin = fin;
        copy.strict = strict;
        copy.domain = domain;
        copy.verbose = verbose;
        return copy;
    }
}
