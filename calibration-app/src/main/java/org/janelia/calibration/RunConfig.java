package org.janelia.calibration;

import java.io.Serializable;

import org.janelia.calibration.combine.CombineConfig;
import org.janelia.calibration.disposition.DispositionConfig;
import org.janelia.calibration.group.GroupingConfig;
import org.janelia.calibration.output.OutputConfig;
import org.janelia.calibration.precalibration.PrecalibrationConfig;

/**
 * Immutable settings for one run of {@link MasterFrameMaker}.
 * Use {@link #newBuilder()} to construct instances, unset parts take their defaults.
 */
public class RunConfig
        implements Serializable {

    private final CombineConfig combineConfig;
    private final GroupingConfig groupingConfig;
    private final PrecalibrationConfig precalibrationConfig;
    private final OutputConfig outputConfig;
    private final DispositionConfig dispositionConfig;
    private final int numberOfThreads;

    private RunConfig(final Builder builder) {
        this.combineConfig = builder.combineConfig;
        this.groupingConfig = builder.groupingConfig;
        this.precalibrationConfig = builder.precalibrationConfig;
        this.outputConfig = builder.outputConfig;
        this.dispositionConfig = builder.dispositionConfig;
        this.numberOfThreads = builder.numberOfThreads;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public CombineConfig getCombineConfig() {
        return combineConfig;
    }

    public GroupingConfig getGroupingConfig() {
        return groupingConfig;
    }

    public PrecalibrationConfig getPrecalibrationConfig() {
        return precalibrationConfig;
    }

    public OutputConfig getOutputConfig() {
        return outputConfig;
    }

    public DispositionConfig getDispositionConfig() {
        return dispositionConfig;
    }

    public int getNumberOfThreads() {
        return numberOfThreads;
    }

    @Override
    public String toString() {
        return "{combine: " + combineConfig +
               ", grouping: " + groupingConfig +
               ", precalibration: " + precalibrationConfig +
               ", output: " + outputConfig +
               ", disposition: " + dispositionConfig +
               ", numberOfThreads: " + numberOfThreads + '}';
    }

    public static class Builder {

        private CombineConfig combineConfig = CombineConfig.mean();
        private GroupingConfig groupingConfig = GroupingConfig.combineEverything();
        private PrecalibrationConfig precalibrationConfig = PrecalibrationConfig.none();
        private OutputConfig outputConfig = OutputConfig.besideInputs();
        private DispositionConfig dispositionConfig = DispositionConfig.leaveInPlace();
        private int numberOfThreads = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder withCombineConfig(final CombineConfig combineConfig) {
            this.combineConfig = combineConfig;
            return this;
        }

        public Builder withGroupingConfig(final GroupingConfig groupingConfig) {
            this.groupingConfig = groupingConfig;
            return this;
        }

        public Builder withPrecalibrationConfig(final PrecalibrationConfig precalibrationConfig) {
            this.precalibrationConfig = precalibrationConfig;
            return this;
        }

        public Builder withOutputConfig(final OutputConfig outputConfig) {
            this.outputConfig = outputConfig;
            return this;
        }

        public Builder withDispositionConfig(final DispositionConfig dispositionConfig) {
            this.dispositionConfig = dispositionConfig;
            return this;
        }

        public Builder withNumberOfThreads(final int numberOfThreads) {
            this.numberOfThreads = numberOfThreads;
            return this;
        }

        /**
         * @throws IllegalArgumentException
         *   if any part is missing, the thread count is not positive,
         *   or a single output path is combined with grouping.
         */
        public RunConfig build()
                throws IllegalArgumentException {

            if ((combineConfig == null) || (groupingConfig == null) || (precalibrationConfig == null) ||
                (outputConfig == null) || (dispositionConfig == null)) {
                throw new IllegalArgumentException("all configuration parts must be specified");
            }
            if (numberOfThreads < 1) {
                throw new IllegalArgumentException("number of threads must be > 0, not " + numberOfThreads);
            }
            if (outputConfig.isSinglePath() && groupingConfig.isGrouping()) {
                throw new IllegalArgumentException(
                        "a single output path cannot be used when grouping, specify an output directory instead");
            }

            return new RunConfig(this);
        }
    }
}
