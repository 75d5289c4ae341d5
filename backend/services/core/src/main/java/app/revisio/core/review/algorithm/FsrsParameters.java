package app.revisio.core.review.algorithm;

import app.revisio.core.review.exception.InvalidParametersException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Weights and policy constants of the scheduler. Instances are immutable and validated on construction.
 *
 * <p>Weight layout: {@code w0..w3} initial stability per rating, {@code w4, w5} initial difficulty,
 * {@code w6, w7} difficulty mean reversion, {@code w8..w10} recall stability growth, {@code w11..w14}
 * stability after a lapse, {@code w14, w15} short-term stability, {@code w15} hard penalty,
 * {@code w16} easy bonus. {@code w17, w18} are carried for compatibility with exported tables.
 */
public record FsrsParameters(
        double[] weights,
        double requestRetention,
        List<Integer> learningStepsMinutes,
        List<Integer> relearningStepsMinutes,
        int graduatingIntervalDays,
        int easyIntervalDays,
        int maximumIntervalDays
) {

    public static final int WEIGHT_COUNT = 19;

    private static final double[] DEFAULT_WEIGHTS = new double[]{
            0.4072, 1.1829, 3.1262, 15.4722, 7.2102, 0.5316, 1.0651, 0.0234, 1.616, 0.1544,
            1.0824, 1.9813, 0.0953, 0.2975, 2.2261, 0.2553, 0.0, 2.7, 0.05
    };

    private static final FsrsParameters DEFAULTS = new FsrsParameters(
            DEFAULT_WEIGHTS, 0.9, List.of(1, 10), List.of(10), 1, 4, 36500
    );

    public FsrsParameters {
        if (weights == null || weights.length != WEIGHT_COUNT) {
            throw new InvalidParametersException("Expected " + WEIGHT_COUNT + " weights, got "
                    + (weights == null ? 0 : weights.length));
        }
        for (int i = 0; i < weights.length; i++) {
            if (!Double.isFinite(weights[i])) {
                throw new InvalidParametersException("Weight w" + i + " is not a finite number");
            }
        }
        if (!(requestRetention > 0.0 && requestRetention < 1.0)) {
            throw new InvalidParametersException("Request retention must be in (0, 1), got " + requestRetention);
        }
        learningStepsMinutes = requireSteps("learning", learningStepsMinutes);
        relearningStepsMinutes = requireSteps("relearning", relearningStepsMinutes);
        if (graduatingIntervalDays < 1 || easyIntervalDays < 1) {
            throw new InvalidParametersException("Graduating and easy intervals must be at least one day");
        }
        if (maximumIntervalDays < Math.max(graduatingIntervalDays, easyIntervalDays)) {
            throw new InvalidParametersException("Maximum interval " + maximumIntervalDays
                    + " is shorter than the graduating or easy interval");
        }
        weights = weights.clone();
    }

    public static FsrsParameters defaults() {
        return DEFAULTS;
    }

    /**
     * Reads a parameter document; every missing or null field keeps its default value.
     */
    public static FsrsParameters from(JsonNode cfg) {
        return DEFAULTS.withOverrides(cfg);
    }

    public FsrsParameters withOverrides(JsonNode cfg) {
        if (cfg == null || cfg.isNull() || cfg.isMissingNode()) {
            return this;
        }
        if (!cfg.isObject()) {
            throw new InvalidParametersException("Scheduler parameters must be a JSON object");
        }

        double[] w = weights;
        if (cfg.hasNonNull("weights")) {
            JsonNode wj = cfg.get("weights");
            if (!wj.isArray()) {
                throw new InvalidParametersException("'weights' must be an array");
            }
            w = new double[wj.size()];
            for (int i = 0; i < wj.size(); i++) {
                if (!wj.get(i).isNumber()) {
                    throw new InvalidParametersException("Weight w" + i + " is not a number");
                }
                w[i] = wj.get(i).asDouble();
            }
        }

        return new FsrsParameters(
                w,
                cfg.hasNonNull("requestRetention") ? cfg.get("requestRetention").asDouble() : requestRetention,
                cfg.hasNonNull("learningStepsMinutes") ? toIntList(cfg.get("learningStepsMinutes")) : learningStepsMinutes,
                cfg.hasNonNull("relearningStepsMinutes") ? toIntList(cfg.get("relearningStepsMinutes")) : relearningStepsMinutes,
                cfg.hasNonNull("graduatingIntervalDays") ? cfg.get("graduatingIntervalDays").asInt() : graduatingIntervalDays,
                cfg.hasNonNull("easyIntervalDays") ? cfg.get("easyIntervalDays").asInt() : easyIntervalDays,
                cfg.hasNonNull("maximumIntervalDays") ? cfg.get("maximumIntervalDays").asInt() : maximumIntervalDays
        );
    }

    public double w(int index) {
        return weights[index];
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FsrsParameters other)) return false;
        return Arrays.equals(weights, other.weights)
                && Double.compare(requestRetention, other.requestRetention) == 0
                && learningStepsMinutes.equals(other.learningStepsMinutes)
                && relearningStepsMinutes.equals(other.relearningStepsMinutes)
                && graduatingIntervalDays == other.graduatingIntervalDays
                && easyIntervalDays == other.easyIntervalDays
                && maximumIntervalDays == other.maximumIntervalDays;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(weights);
        result = 31 * result + Double.hashCode(requestRetention);
        result = 31 * result + learningStepsMinutes.hashCode();
        result = 31 * result + relearningStepsMinutes.hashCode();
        result = 31 * result + graduatingIntervalDays;
        result = 31 * result + easyIntervalDays;
        result = 31 * result + maximumIntervalDays;
        return result;
    }

    @Override
    public String toString() {
        return "FsrsParameters[weights=" + Arrays.toString(weights)
                + ", requestRetention=" + requestRetention
                + ", learningStepsMinutes=" + learningStepsMinutes
                + ", relearningStepsMinutes=" + relearningStepsMinutes
                + ", graduatingIntervalDays=" + graduatingIntervalDays
                + ", easyIntervalDays=" + easyIntervalDays
                + ", maximumIntervalDays=" + maximumIntervalDays + "]";
    }

    private static List<Integer> requireSteps(String name, List<Integer> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidParametersException("At least one " + name + " step is required");
        }
        for (Integer step : steps) {
            if (step == null || step < 1) {
                throw new InvalidParametersException("The " + name + " steps must be positive minute counts");
            }
        }
        return List.copyOf(steps);
    }

    private static List<Integer> toIntList(JsonNode n) {
        if (!n.isArray()) {
            throw new InvalidParametersException("Step tables must be arrays of minutes");
        }
        List<Integer> out = new ArrayList<>();
        for (JsonNode x : n) out.add(x.asInt());
        return out;
    }
}
