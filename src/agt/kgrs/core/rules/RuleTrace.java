package kgrs.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trace of one rule application.
 * Records every derivation step or rule that ran, how many triples it added,
 * and the diagnostics of rules that were skipped.
 */
public class RuleTrace {

    /**
     * Record of a single step: a fixed derivation or one declarative rule.
     */
    public static class StepRecord {
        private final String tierId;
        private final String stepId;
        private final int triplesAdded;
        private final long elapsedMs;

        public StepRecord(String tierId, String stepId, int triplesAdded, long elapsedMs) {
            this.tierId = tierId;
            this.stepId = stepId;
            this.triplesAdded = triplesAdded;
            this.elapsedMs = elapsedMs;
        }

        public String getTierId() {
            return tierId;
        }

        public String getStepId() {
            return stepId;
        }

        public int getTriplesAdded() {
            return triplesAdded;
        }

        public long getElapsedMs() {
            return elapsedMs;
        }

        @Override
        public String toString() {
            return String.format("%s/%s: +%d (%dms)", tierId, stepId, triplesAdded, elapsedMs);
        }
    }

    private final List<StepRecord> steps;
    private final List<RuleDiagnostic> diagnostics;
    private final int inputSize;
    private final int outputSize;
    private final long totalTimeMs;

    private RuleTrace(Builder builder) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(builder.steps));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(builder.diagnostics));
        this.inputSize = builder.inputSize;
        this.outputSize = builder.outputSize;
        this.totalTimeMs = builder.totalTimeMs;
    }

    public List<StepRecord> getSteps() {
        return steps;
    }

    public List<RuleDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public int getInputSize() {
        return inputSize;
    }

    public int getOutputSize() {
        return outputSize;
    }

    public int getTriplesAdded() {
        return outputSize - inputSize;
    }

    public long getTotalTimeMs() {
        return totalTimeMs;
    }

    @Override
    public String toString() {
        return String.format("RuleTrace{steps=%d, added=%d, skipped=%d, time=%dms}",
            steps.size(), getTriplesAdded(), diagnostics.size(), totalTimeMs);
    }

    public static Builder builder(int inputSize) {
        return new Builder(inputSize);
    }

    public static class Builder {
        private final List<StepRecord> steps = new ArrayList<>();
        private final List<RuleDiagnostic> diagnostics = new ArrayList<>();
        private final int inputSize;
        private int outputSize;
        private long totalTimeMs;
        private boolean recordSteps = true;

        private Builder(int inputSize) {
            this.inputSize = inputSize;
            this.outputSize = inputSize;
        }

        /**
         * Turn step recording on or off. Diagnostics are always kept.
         */
        public Builder recordSteps(boolean enabled) {
            this.recordSteps = enabled;
            return this;
        }

        public Builder addStep(String tierId, String stepId, int triplesAdded, long elapsedMs) {
            if (recordSteps) {
                steps.add(new StepRecord(tierId, stepId, triplesAdded, elapsedMs));
            }
            return this;
        }

        public Builder addDiagnostic(RuleDiagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        public Builder outputSize(int size) {
            this.outputSize = size;
            return this;
        }

        public Builder totalTime(long ms) {
            this.totalTimeMs = ms;
            return this;
        }

        public RuleTrace build() {
            return new RuleTrace(this);
        }
    }
}
