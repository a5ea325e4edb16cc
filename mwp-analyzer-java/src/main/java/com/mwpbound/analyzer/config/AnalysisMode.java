package com.mwpbound.analyzer.config;

import com.google.gson.annotations.SerializedName;

public enum AnalysisMode {
    /** Whole-function analysis: one relation and bound per function. */
    @SerializedName("function") FUNCTION,
    /** Each loop analysed on its own, with a growth class per variable. */
    @SerializedName("loop") LOOP
}
