package com.includeslice.cli.report;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs for include_report.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static final String REPORT_VERSION = "0.1";

    public static class ReportRoot {
        @SerializedName("report_version")   public String reportVersion;
        @SerializedName("tool_version")     public String toolVersion;
        @SerializedName("main_file")        public String mainFile;
        @SerializedName("config")           public ReportConfig config;
        @SerializedName("summary")          public ReportSummary summary;
        @SerializedName("unused_includes")  public List<UnusedInclude> unusedIncludes;
        @SerializedName("includes")         public List<IncludeEntry> includes;
        @SerializedName("references")       public List<ReferenceEntry> references;
    }

    public static class ReportConfig {
        @SerializedName("construction")   public boolean construction;
        @SerializedName("members")        public boolean members;
        @SerializedName("operators")      public boolean operators;
        @SerializedName("analyze_stdlib") public boolean analyzeStdlib;
        @SerializedName("recover")        public boolean recover;
    }

    public static class ReportSummary {
        @SerializedName("includes")     public int includes;
        @SerializedName("used")         public int used;
        @SerializedName("unused")       public int unused;
        @SerializedName("kept")         public int kept;
        @SerializedName("references")   public int references;
        @SerializedName("unsatisfied")  public int unsatisfied;
        @SerializedName("no_header")    public int noHeader;
    }

    public static class UnusedInclude {
        @SerializedName("spelled")  public String spelled;
        @SerializedName("resolved") public String resolved;  // nullable
        @SerializedName("line")     public int line;
        @SerializedName("message")  public String message;
        @SerializedName("fix")      public Fix fix;
    }

    /** Delete from the start of {@code start_line} to the start of {@code end_line}. */
    public static class Fix {
        @SerializedName("start_line") public int startLine;
        @SerializedName("end_line")   public int endLine;
    }

    public static class IncludeEntry {
        @SerializedName("spelled")     public String spelled;
        @SerializedName("resolved")    public String resolved;     // nullable
        @SerializedName("line")        public int line;
        @SerializedName("status")      public String status;       // used, unused, kept
        @SerializedName("keep_reason") public String keepReason;   // kept only
        @SerializedName("first_use")   public String firstUse;     // used only, e.g. "CXXRecord Foo"
    }

    public static class ReferenceEntry {
        @SerializedName("location")     public String location;
        @SerializedName("line")         public int line;
        @SerializedName("column")       public int column;
        @SerializedName("symbol")       public String symbol;
        @SerializedName("kind")         public String kind;         // macro or declaration kind
        @SerializedName("verdict")      public String verdict;      // satisfied, unsatisfied, no_header
        @SerializedName("satisfied_by") public String satisfiedBy;  // nullable
        @SerializedName("providers")    public List<String> providers;
    }
}
