package org.scalebaron.layout;

/**
 * Block-mean downsampling for composites with many samples.
 *
 * <p>The block factor is {@code floor(max(h, w) / targetMax)}; rows and columns that do not fill a
 * whole block are cropped. Each output pixel is the mean of the valid pixels in its block, NaN if
 * the block has none. Matrices already within the target are returned as a copy.
 */
public class MatrixDownsampler {

    public static final int DEFAULT_TARGET_MAX = 512;

    private final int targetMax;

    public MatrixDownsampler() {
        this(DEFAULT_TARGET_MAX);
    }

    public MatrixDownsampler(int targetMax) {
        if (targetMax < 1) {
            throw new IllegalArgumentException("Target size must be at least 1: " + targetMax);
        }
        this.targetMax = targetMax;
    }

    /**
     * @param values matrix cells, {@code [row][column]}, rectangular
     * @return the downsampled matrix
     */
    public double[][] downsample(double[][] values) {
        int h = values.length;
        int w = h == 0 ? 0 : values[0].length;
        double scale = Math.max(h, w) / (double) targetMax;
        if (scale <= 1) {
            double[][] copy = new double[h][];
            for (int r = 0; r < h; r++) {
                copy[r] = values[r].clone();
            }
            return copy;
        }
        int factor = Math.max(1, (int) scale);
        int outH = h / factor;
        int outW = w / factor;
        double[][] out = new double[outH][outW];
        for (int r = 0; r < outH; r++) {
            for (int c = 0; c < outW; c++) {
                double sum = 0;
                int n = 0;
                for (int dr = 0; dr < factor; dr++) {
                    double[] src = values[r * factor + dr];
                    for (int dc = 0; dc < factor; dc++) {
                        double v = src[c * factor + dc];
                        if (!Double.isNaN(v)) {
                            sum += v;
                            n++;
                        }
                    }
                }
                out[r][c] = n == 0 ? Double.NaN : sum / n;
            }
        }
        return out;
    }

    public int getTargetMax() {
        return targetMax;
    }
}
