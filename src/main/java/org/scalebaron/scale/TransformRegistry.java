package org.scalebaron.scale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe static registry mapping transform names to {@link IntensityTransform} implementations.
 *
 * <p>The built-in transforms are registered on class load:
 * <ul>
 *   <li>{@code linear} : {@link LinearTransform}</li>
 *   <li>{@code log} : {@link Log1pTransform} with a lower bound of 1</li>
 *   <li>{@code ecdf} : {@link EcdfTransform}</li>
 * </ul>
 *
 * <p>Names are matched case-insensitively. Lookups of unknown names do not fail: they log a warning
 * and return the linear transform so a batch never stops over a display setting.
 *
 * <pre>{@code
 * TransformRegistry.register("log10", new MyLog10Transform());
 * IntensityTransform t = TransformRegistry.get(resolvedScale.transformName());
 * Normalization norm = t.createNormalization(resolvedScale.value(), pooledPixels);
 * }</pre>
 *
 * @author Mike Nelson
 * @since 0.2
 * @see IntensityTransform
 */
public final class TransformRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TransformRegistry.class);

    private static final Map<String, IntensityTransform> TRANSFORMS = new ConcurrentHashMap<>();
    private static final IntensityTransform FALLBACK = new LinearTransform();

    static {
        register(LinearTransform.NAME, FALLBACK);
        register(Log1pTransform.NAME, new Log1pTransform());
        register(EcdfTransform.NAME, new EcdfTransform());
        logger.debug("TransformRegistry initialized with {} transforms", TRANSFORMS.size());
    }

    private TransformRegistry() {
        // Utility class - no instantiation
    }

    /**
     * Registers (or replaces) the transform for a name.
     *
     * @param name transform name; null or blank names are ignored with a warning
     * @param transform the implementation; null is ignored with a warning
     */
    public static void register(String name, IntensityTransform transform) {
        if (name == null || name.trim().isEmpty()) {
            logger.warn("Attempted to register transform with null or empty name - ignoring registration");
            return;
        }
        if (transform == null) {
            logger.warn("Attempted to register null transform for '{}' - ignoring registration", name);
            return;
        }
        String normalized = name.toLowerCase().trim();
        IntensityTransform previous = TRANSFORMS.put(normalized, transform);
        if (previous != null && previous != transform) {
            logger.warn("Replaced transform '{}': {} -> {}", normalized,
                    previous.getClass().getSimpleName(), transform.getClass().getSimpleName());
        } else {
            logger.debug("Registered transform '{}': {}", normalized, transform.getClass().getSimpleName());
        }
    }

    /**
     * Returns the transform registered for {@code name}, or the linear transform if none is.
     * Never returns null.
     */
    public static IntensityTransform get(String name) {
        if (name == null || name.trim().isEmpty()) {
            return FALLBACK;
        }
        IntensityTransform transform = TRANSFORMS.get(name.toLowerCase().trim());
        if (transform == null) {
            logger.warn("No transform registered for '{}' - using linear. Registered: {}", name, TRANSFORMS.keySet());
            return FALLBACK;
        }
        return transform;
    }

    public static Set<String> getRegisteredNames() {
        return Set.copyOf(TRANSFORMS.keySet());
    }
}
