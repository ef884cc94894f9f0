package ch.so.arp.rag.hybrid.parameter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable version of a learnable parameter. Scalars are stored as one-element
 * vectors; matrices are stored row-major. Every value is kept within
 * {@code [lowerBound, upperBound]}.
 *
 * @param lastReinforcedAt last time feedback changed the value; decay does not
 *                         move this timestamp
 */
public record VersionedParameter(
        String key,
        double[] values,
        double[] priors,
        double lowerBound,
        double upperBound,
        long version,
        Instant updatedAt,
        Instant lastReinforcedAt) {

    public VersionedParameter {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(priors, "priors");
        if (values.length != priors.length) {
            throw new IllegalArgumentException("values and priors of '" + key + "' differ in length");
        }
        if (!(lowerBound >= 0.0d && upperBound <= 1.0d && lowerBound < upperBound)) {
            throw new IllegalArgumentException("bounds of '" + key + "' must satisfy 0 <= lower < upper <= 1");
        }
        values = values.clone();
        priors = priors.clone();
        for (double value : values) {
            if (!(value >= lowerBound && value <= upperBound)) {
                throw new IllegalArgumentException("value " + value + " of '" + key + "' is outside its bounds");
            }
        }
    }

    public static VersionedParameter initial(String key, double[] priors, double lowerBound, double upperBound,
            Instant now) {
        double[] clamped = Arrays.stream(priors).map(prior -> Math.max(lowerBound, Math.min(upperBound, prior)))
                .toArray();
        return new VersionedParameter(key, clamped, clamped, lowerBound, upperBound, 0L, now, now);
    }

    public static VersionedParameter scalar(String key, double prior, double lowerBound, double upperBound,
            Instant now) {
        return initial(key, new double[] { prior }, lowerBound, upperBound, now);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public double[] priors() {
        return priors.clone();
    }

    public double value() {
        return values[0];
    }

    public double prior() {
        return priors[0];
    }

    public int size() {
        return values.length;
    }

    public double clamp(double value) {
        return Math.max(lowerBound, Math.min(upperBound, value));
    }

    /**
     * Next version carrying the given values, clamped to the declared bounds.
     */
    public VersionedParameter next(double[] newValues, Instant now, boolean reinforced) {
        if (newValues.length != values.length) {
            throw new IllegalArgumentException("'" + key + "' expects " + values.length + " values");
        }
        double[] clamped = new double[newValues.length];
        for (int i = 0; i < newValues.length; i++) {
            double candidate = Double.isFinite(newValues[i]) ? newValues[i] : values[i];
            clamped[i] = clamp(candidate);
        }
        return new VersionedParameter(key, clamped, priors, lowerBound, upperBound, version + 1, now,
                reinforced ? now : lastReinforcedAt);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VersionedParameter that)) {
            return false;
        }
        return version == that.version && key.equals(that.key) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, version, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "VersionedParameter[" + key + " v" + version + " " + Arrays.toString(values.length > 8
                ? Arrays.copyOf(values, 8) : values) + "]";
    }
}
