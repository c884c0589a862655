package com.includeslice.cli.config;

import com.google.gson.annotations.SerializedName;
import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.analysis.Policy;

/**
 * Deserialized form of include-slice.json. Every field is optional.
 */
public class CleanerConfig {

    /** Does constructing a type without naming it count as a use? (default: false). */
    @SerializedName("construction")
    private Boolean construction;

    /** Is member access a reference? (default: false). */
    @SerializedName("members")
    private Boolean members;

    /** Are operator calls references? (default: false). */
    @SerializedName("operators")
    private Boolean operators;

    /** May angled includes of known standard headers be reported unused? (default: false). */
    @SerializedName("analyze_stdlib")
    private Boolean analyzeStdlib;

    /** Report a missing header once, not at every reference it provides (default: true). */
    @SerializedName("recover")
    private Boolean recover;

    /** Also report satisfied references and used includes (default: false). */
    @SerializedName("show_satisfied")
    private Boolean showSatisfied;

    /** Exit with code 3 when unused includes are found (default: false). */
    @SerializedName("fail_on_unused")
    private Boolean failOnUnused;

    public boolean isConstruction()     { return construction != null && construction; }
    public boolean isMembers()          { return members != null && members; }
    public boolean isOperators()        { return operators != null && operators; }
    public boolean isAnalyzeStdlib()    { return analyzeStdlib != null && analyzeStdlib; }
    public boolean isRecover()          { return recover == null || recover; }
    public boolean isShowSatisfied()    { return showSatisfied != null && showSatisfied; }
    public boolean isFailOnUnused()     { return failOnUnused != null && failOnUnused; }

    public void setConstruction(boolean value)  { this.construction = value; }
    public void setMembers(boolean value)       { this.members = value; }
    public void setOperators(boolean value)     { this.operators = value; }
    public void setAnalyzeStdlib(boolean value) { this.analyzeStdlib = value; }
    public void setRecover(boolean value)       { this.recover = value; }
    public void setShowSatisfied(boolean value) { this.showSatisfied = value; }
    public void setFailOnUnused(boolean value)  { this.failOnUnused = value; }

    public AnalysisConfig toAnalysisConfig() {
        Policy policy = new Policy(isConstruction(), isMembers(), isOperators());
        return new AnalysisConfig(policy, isAnalyzeStdlib(), isRecover());
    }
}
