package org.scalebaron.progress;

import org.scalebaron.model.Sample;
import org.scalebaron.model.SampleSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A user action on the sample set, applied through {@link SampleInclusion#execute(InclusionCommand)}.
 *
 * <p>Commands return a new {@link SampleSet}; they never mutate the one they receive. Commands
 * naming an unknown sample leave the set unchanged.
 */
@FunctionalInterface
public interface InclusionCommand {

    SampleSet apply(SampleSet current);

    /**
     * Flips the inclusion flag of one sample.
     */
    static InclusionCommand toggle(String sample) {
        return current -> current.get(sample)
                .map(s -> current.with(s.withIncluded(!s.included())))
                .orElse(current);
    }

    static InclusionCommand setIncluded(String sample, boolean included) {
        return current -> current.get(sample)
                .map(s -> current.with(s.withIncluded(included)))
                .orElse(current);
    }

    static InclusionCommand includeAll() {
        return current -> allWith(current, true);
    }

    static InclusionCommand excludeAll() {
        return current -> allWith(current, false);
    }

    /**
     * Assigns custom pixel sizes. Samples absent from {@code sizes} keep theirs.
     */
    static InclusionCommand assignPixelSizes(Map<String, Double> sizes) {
        return current -> {
            SampleSet result = current;
            for (Map.Entry<String, Double> entry : sizes.entrySet()) {
                SampleSet base = result;
                result = base.get(entry.getKey())
                        .map(s -> base.with(s.withPixelSize(entry.getValue())))
                        .orElse(base);
            }
            return result;
        };
    }

    private static SampleSet allWith(SampleSet current, boolean included) {
        List<Sample> samples = new ArrayList<>();
        for (Sample sample : current.all()) {
            samples.add(sample.withIncluded(included));
        }
        return SampleSet.ofSamples(samples);
    }
}
