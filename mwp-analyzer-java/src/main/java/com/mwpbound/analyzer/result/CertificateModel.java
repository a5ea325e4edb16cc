package com.mwpbound.analyzer.result;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of the JSON analysis certificate.
 * Field names use @SerializedName for JSON snake_case mapping; null fields are omitted.
 */
public final class CertificateModel {

    public static final String VERSION = "0.1";

    private CertificateModel() {}

    public static class CertRoot {
        @SerializedName("version")   public String version;
        @SerializedName("mode")      public String mode;
        @SerializedName("functions") public List<CertFunction> functions;
        @SerializedName("loops")     public List<CertLoop> loops;
        @SerializedName("time_ms")   public long timeMs;
    }

    public static class CertFunction {
        @SerializedName("name")           public String name;
        @SerializedName("variables")      public List<String> variables;
        @SerializedName("index")          public int index;
        @SerializedName("infinite")       public boolean infinite;
        @SerializedName("relation")       public List<List<String>> relation;     // nullable
        @SerializedName("choices")        public List<List<List<Integer>>> choices; // nullable
        @SerializedName("bounds")         public List<CertBound> bounds;          // nullable
        @SerializedName("infinity_flows") public List<String> infinityFlows;
        @SerializedName("time_ms")        public long timeMs;
    }

    public static class CertBound {
        @SerializedName("variable") public String variable;
        @SerializedName("bound")    public String bound;
        @SerializedName("x")        public List<String> x;
        @SerializedName("y")        public List<String> y;
        @SerializedName("z")        public List<String> z;
    }

    public static class CertLoop {
        @SerializedName("function")  public String function;
        @SerializedName("kind")      public String kind;     // while, do_while, loop
        @SerializedName("ordinal")   public int ordinal;
        @SerializedName("variables") public List<CertVariable> variables;
        @SerializedName("time_ms")   public long timeMs;
    }

    public static class CertVariable {
        @SerializedName("name")    public String name;
        @SerializedName("growth")  public String growth;     // m, w, p; null when unbounded
        @SerializedName("choices") public List<List<List<Integer>>> choices;
        @SerializedName("bound")   public CertBound bound;
    }
}
