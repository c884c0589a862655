package com.includeslice.core.analysis;

/**
 * Configuration of one analysis run.
 *
 * @param policy        what counts as a use
 * @param analyzeStdlib whether angle-bracket includes of standard library headers may be
 *                      reported unused. Off by default: the logical header mapping for
 *                      standard symbols is incomplete, so such reports are unreliable.
 * @param recover       whether a header reported missing once satisfies later references
 *                      it provides, so each missing include is reported once. On by default.
 */
public record AnalysisConfig(Policy policy, boolean analyzeStdlib, boolean recover) {

    public static final AnalysisConfig DEFAULT = new AnalysisConfig(Policy.DEFAULT, false, true);

    public AnalysisConfig withPolicy(Policy value)          { return new AnalysisConfig(value, analyzeStdlib, recover); }
    public AnalysisConfig withAnalyzeStdlib(boolean value)  { return new AnalysisConfig(policy, value, recover); }
    public AnalysisConfig withRecover(boolean value)        { return new AnalysisConfig(policy, analyzeStdlib, value); }
}
