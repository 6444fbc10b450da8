package org.ultracam.snorm;

import java.util.Locale;
import org.ultracam.snorm.fit.CurveModel;
import org.ultracam.snorm.fit.PolynomialModel;
import org.ultracam.snorm.fit.RobustFitter;
import org.ultracam.snorm.fit.SplineModel;

/**
 * Validated parameters of one normalization run. Instances are built once, by
 * {@link Builder#build()}, and never change afterwards.
 *
 * The tuning parameters not exposed on the command line default to the system
 * properties {@code org.ultracam.snorm.maxCycles},
 * {@code org.ultracam.snorm.timeoutMillis} and
 * {@code org.ultracam.snorm.edgePolicy}.
 *
 * @author ultracam
 */
public class NormalizationConfig {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private final String device;
    private final int nccd;
    private final String input;
    private final String output;
    private final int x1;
    private final int x2;
    private final int y1;
    private final int y2;
    private final FitDomain fitDomain;
    private final int ncoeff;
    private final double threshold;
    private final int maxCycles;
    private final long timeoutMillis;
    private final Normalizer.EdgePolicy edgePolicy;

    private NormalizationConfig(Builder builder) {
        this.device = builder.device;
        this.nccd = builder.nccd;
        this.input = builder.input;
        this.output = builder.output;
        this.x1 = builder.x1;
        this.x2 = builder.x2;
        this.y1 = builder.y1;
        this.y2 = builder.y2;
        this.fitDomain = new FitDomain(builder.xf1, builder.xf2);
        this.ncoeff = builder.ncoeff;
        this.threshold = builder.threshold;
        this.maxCycles = builder.maxCycles;
        this.timeoutMillis = builder.timeoutMillis;
        this.edgePolicy = builder.edgePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDevice() {
        return device;
    }

    /**
     * @return The CCD to normalize, starting at 1
     */
    public int getNccd() {
        return nccd;
    }

    public String getInput() {
        return input;
    }

    public String getOutput() {
        return output;
    }

    public int getX1() {
        return x1;
    }

    public int getX2() {
        return x2;
    }

    public int getY1() {
        return y1;
    }

    public int getY2() {
        return y2;
    }

    public FitDomain getFitDomain() {
        return fitDomain;
    }

    public int getNcoeff() {
        return ncoeff;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMaxCycles() {
        return maxCycles;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public Normalizer.EdgePolicy getEdgePolicy() {
        return edgePolicy;
    }

    /**
     * The model family selected by ncoeff: a negative value gives a
     * polynomial of degree |ncoeff|-1, a positive one a cubic spline with
     * ncoeff interior knots over the fit domain.
     *
     * @return The curve model
     */
    public CurveModel createModel() {
        if (ncoeff < 0) {
            return new PolynomialModel(-ncoeff - 1);
        } else {
            return new SplineModel(ncoeff, fitDomain.getXf1(), fitDomain.getXf2());
        }
    }

    public RobustFitter createFitter() {
        return new RobustFitter(createModel(), threshold, maxCycles, timeoutMillis);
    }

    @Override
    public String toString() {
        return "NormalizationConfig{" + "nccd=" + nccd + ", input=" + input + ", output=" + output + ", x=[" + x1 + "," + x2 + "], y=[" + y1 + "," + y2
                + "], fit=" + fitDomain + ", ncoeff=" + ncoeff + ", threshold=" + threshold + ", maxCycles=" + maxCycles + ", edgePolicy=" + edgePolicy + '}';
    }

    public static class Builder {

        private String device = "null";
        private int nccd = 1;
        private String input;
        private String output;
        private int x1;
        private int x2;
        private int y1;
        private int y2;
        private int xf1;
        private int xf2;
        private int ncoeff;
        private double threshold = DEFAULT_THRESHOLD;
        private int maxCycles = Integer.getInteger("org.ultracam.snorm.maxCycles", RobustFitter.DEFAULT_MAX_CYCLES);
        private long timeoutMillis = Long.getLong("org.ultracam.snorm.timeoutMillis", 0L);
        private String edgePolicyName = System.getProperty("org.ultracam.snorm.edgePolicy", Normalizer.EdgePolicy.LEAVE.name());
        private Normalizer.EdgePolicy edgePolicy;

        private Builder() {
        }

        public Builder device(String device) {
            this.device = device;
            return this;
        }

        public Builder nccd(int nccd) {
            this.nccd = nccd;
            return this;
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder okRange(int x1, int x2) {
            this.x1 = x1;
            this.x2 = x2;
            return this;
        }

        public Builder extractionRange(int y1, int y2) {
            this.y1 = y1;
            this.y2 = y2;
            return this;
        }

        public Builder fitRange(int xf1, int xf2) {
            this.xf1 = xf1;
            this.xf2 = xf2;
            return this;
        }

        public Builder ncoeff(int ncoeff) {
            this.ncoeff = ncoeff;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder maxCycles(int maxCycles) {
            this.maxCycles = maxCycles;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder edgePolicy(Normalizer.EdgePolicy edgePolicy) {
            this.edgePolicyName = edgePolicy.name();
            return this;
        }

        /**
         * Check every parameter and create the configuration.
         *
         * @return The validated configuration
         * @throws ValidationException If any parameter is out of range
         */
        public NormalizationConfig build() throws ValidationException {
            if (nccd < 1) {
                throw new ValidationException("nccd must be at least 1, got " + nccd);
            }
            if (input == null || input.trim().isEmpty()) {
                throw new ValidationException("No input frame given");
            }
            if (output == null || output.trim().isEmpty()) {
                throw new ValidationException("No output frame given");
            }
            if (x1 >= x2) {
                throw new ValidationException(String.format("x1 must be less than x2, got x1=%d, x2=%d", x1, x2));
            }
            if (y1 > y2) {
                throw new ValidationException(String.format("y1 must not exceed y2, got y1=%d, y2=%d", y1, y2));
            }
            if (xf1 >= xf2) {
                throw new ValidationException(String.format("xf1 must be less than xf2, got xf1=%d, xf2=%d", xf1, xf2));
            }
            if (xf1 < x1 || xf2 > x2) {
                throw new ValidationException(String.format("Fit range [%d,%d] must lie within the OK range [%d,%d]", xf1, xf2, x1, x2));
            }
            if (ncoeff == 0) {
                throw new ValidationException("ncoeff must not be 0");
            }
            if (!(threshold > 1) || Double.isInfinite(threshold)) {
                throw new ValidationException("thresh must be greater than 1, got " + threshold);
            }
            if (maxCycles < 1) {
                throw new ValidationException("maxCycles must be at least 1, got " + maxCycles);
            }
            if (timeoutMillis < 0) {
                throw new ValidationException("timeoutMillis must not be negative, got " + timeoutMillis);
            }
            try {
                edgePolicy = Normalizer.EdgePolicy.valueOf(edgePolicyName.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException x) {
                throw new ValidationException("Unknown edge policy: " + edgePolicyName, x);
            }
            return new NormalizationConfig(this);
        }
    }
}
