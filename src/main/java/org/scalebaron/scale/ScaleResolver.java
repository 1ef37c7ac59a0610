package org.scalebaron.scale;

import org.scalebaron.exceptions.EmptyDataException;
import org.scalebaron.exceptions.InvalidScaleException;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ResolvedScale;
import org.scalebaron.model.SampleSet;
import org.scalebaron.model.ScaleConfig;
import org.scalebaron.model.ScaleMode;
import org.scalebaron.model.StatisticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * ScaleResolver
 *
 * <p>Derives the one display maximum every included sample of an element is rendered with:
 * <ul>
 *   <li><b>auto-percentile</b>: the largest 99th percentile among included samples. A single
 *       sample's extreme pixels cannot saturate the others, and all samples still share one
 *       ceiling. The value is 0 for an element whose valid pixels are all zero; the transforms
 *       then draw every valid pixel at the bottom of the colormap.</li>
 *   <li><b>user-fixed</b>: the supplied number, which must be finite and positive.</li>
 *   <li><b>log / ecdf</b>: the supplied number if there is one, otherwise the auto-percentile
 *       value, tagged with the transform the renderer applies.</li>
 * </ul>
 *
 * <p>The resolver is pure: it reads the statistics it is handed and changes nothing, so resolving
 * again with another config, or after toggling a sample, is safe to repeat.
 */
public class ScaleResolver {
    private static final Logger logger = LoggerFactory.getLogger(ScaleResolver.class);

    /**
     * Resolves the scale of one element.
     *
     * @param element the element column
     * @param samples sample set carrying the inclusion flags
     * @param statistics statistics per sample name for this element; samples without an entry
     *                   (failed to load) are ignored
     * @param config scale setting for the element
     * @return the resolved scale
     * @throws InvalidScaleException if a user value is not finite and positive
     * @throws EmptyDataException if a percentile-based mode has no included sample with statistics
     */
    public ResolvedScale resolve(ElementKey element, SampleSet samples,
                                 Map<String, StatisticsRecord> statistics, ScaleConfig config) {
        ScaleMode mode = config.mode();
        int contributing = countContributing(samples, statistics);

        double value;
        if (mode == ScaleMode.USER_FIXED) {
            if (config.value() == null) {
                throw new InvalidScaleException(Double.NaN);
            }
            value = validateUserValue(config.value());
        } else if ((mode == ScaleMode.LOG || mode == ScaleMode.ECDF) && config.value() != null) {
            value = validateUserValue(config.value());
        } else {
            value = maxIncludedP99(element, samples, statistics);
        }

        logger.debug("Resolved scale for {}: {} ({} over {} sample(s))", element, value, mode, contributing);
        return new ResolvedScale(element, value, mode, mode.getTransformName(), contributing);
    }

    /**
     * @return max p99 over included samples that have statistics
     * @throws EmptyDataException if there are none
     */
    public double maxIncludedP99(ElementKey element, SampleSet samples, Map<String, StatisticsRecord> statistics) {
        double max = Double.NEGATIVE_INFINITY;
        boolean any = false;
        for (Map.Entry<String, StatisticsRecord> entry : statistics.entrySet()) {
            if (!samples.isIncluded(entry.getKey())) {
                continue;
            }
            any = true;
            max = Math.max(max, entry.getValue().p99());
        }
        if (!any) {
            throw new EmptyDataException("No included sample with statistics for " + element);
        }
        return max;
    }

    /**
     * @throws InvalidScaleException if {@code value} is not finite and strictly positive
     */
    public static double validateUserValue(double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidScaleException(value);
        }
        return value;
    }

    private static int countContributing(SampleSet samples, Map<String, StatisticsRecord> statistics) {
        int n = 0;
        for (String sample : statistics.keySet()) {
            if (samples.isIncluded(sample)) {
                n++;
            }
        }
        return n;
    }
}
