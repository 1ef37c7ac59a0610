package org.scalebaron.progress;

import org.scalebaron.model.SampleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Holds the current sample set. Inclusion changes only through explicit commands; the progress
 * scan reads the flags but never changes them.
 */
public class SampleInclusion {
    private static final Logger logger = LoggerFactory.getLogger(SampleInclusion.class);

    private volatile SampleSet samples;

    public SampleInclusion(SampleSet samples) {
        this.samples = samples;
    }

    public static SampleInclusion allIncluded(Collection<String> names) {
        return new SampleInclusion(SampleSet.of(names));
    }

    public SampleSet current() {
        return samples;
    }

    /**
     * Applies a command and returns the resulting set.
     */
    public synchronized SampleSet execute(InclusionCommand command) {
        SampleSet before = samples;
        SampleSet after = command.apply(before);
        samples = after;
        if (logger.isDebugEnabled() && !before.includedNames().equals(after.includedNames())) {
            logger.debug("Included samples changed: {} -> {}", before.includedNames(), after.includedNames());
        }
        return after;
    }

    /**
     * Adds newly discovered samples, included by default; existing flags are kept.
     */
    public synchronized SampleSet register(List<String> names) {
        samples = samples.mergeNames(names);
        return samples;
    }
}
