package com.eainde.boardingpass.pipeline;

import java.util.List;

/**
 * Either a candidate or a failure, plus the warnings a strategy collected on the way.
 */
public final class StrategyOutcome {

    private final Candidate candidate;
    private final StrategyFailure failure;
    private final List<String> warnings;

    private StrategyOutcome(Candidate candidate, StrategyFailure failure, List<String> warnings) {
        this.candidate = candidate;
        this.failure = failure;
        this.warnings = List.copyOf(warnings);
    }

    public static StrategyOutcome success(Candidate candidate) {
        return new StrategyOutcome(candidate, null, candidate.warnings());
    }

    public static StrategyOutcome failure(StrategyFailure failure) {
        return new StrategyOutcome(null, failure, List.of());
    }

    public static StrategyOutcome failure(StrategyFailure failure, List<String> warnings) {
        return new StrategyOutcome(null, failure, warnings);
    }

    public boolean isSuccess() {
        return candidate != null;
    }

    public Candidate getCandidate() {
        return candidate;
    }

    public StrategyFailure getFailure() {
        return failure;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
