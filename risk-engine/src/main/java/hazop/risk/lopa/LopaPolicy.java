package hazop.risk.lopa;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Gap-ratio thresholds and the additional-RRF to SIL banding. Ratios are compared
 * with a relative tolerance so that an exact match of achieved and required RRF
 * stays adequate despite floating-point division.
 */
@Component
public class LopaPolicy {
    private static final double RELATIVE_TOLERANCE = 1e-9;

    private final double adequateGapRatio;
    private final double marginalGapRatio;
    private final double[] silRrfBounds;

    public LopaPolicy(
            @Value("${hazop.lopa.adequate-gap-ratio:1.0}") double adequateGapRatio,
            @Value("${hazop.lopa.marginal-gap-ratio:0.5}") double marginalGapRatio,
            @Value("${hazop.lopa.sil-rrf-bounds:100,1000,10000}") double[] silRrfBounds
    ) {
        if (marginalGapRatio <= 0 || adequateGapRatio <= marginalGapRatio) {
            throw new IllegalArgumentException(
                    "hazop.lopa gap thresholds must satisfy 0 < marginal < adequate, got marginal="
                            + marginalGapRatio + " adequate=" + adequateGapRatio);
        }
        if (silRrfBounds.length != 3) {
            throw new IllegalArgumentException("hazop.lopa.sil-rrf-bounds needs exactly 3 values for SIL 1-3");
        }
        for (int i = 1; i < silRrfBounds.length; i++) {
            if (silRrfBounds[i] <= silRrfBounds[i - 1]) {
                throw new IllegalArgumentException("hazop.lopa.sil-rrf-bounds must be ascending");
            }
        }
        this.adequateGapRatio = adequateGapRatio;
        this.marginalGapRatio = marginalGapRatio;
        this.silRrfBounds = silRrfBounds.clone();
    }

    public static LopaPolicy defaults() {
        return new LopaPolicy(1.0, 0.5, new double[]{100, 1000, 10000});
    }

    public GapStatus classify(double gapRatio) {
        if (atLeast(gapRatio, adequateGapRatio)) {
            return GapStatus.ADEQUATE;
        }
        if (atLeast(gapRatio, marginalGapRatio)) {
            return GapStatus.MARGINAL;
        }
        return GapStatus.INADEQUATE;
    }

    /**
     * Maps the extra risk reduction still needed onto a SIL. A shortfall below the
     * first band still calls for SIL 1, the lowest creditable SIF.
     */
    public int requiredSil(double additionalRrf) {
        for (int i = 0; i < silRrfBounds.length; i++) {
            if (additionalRrf <= silRrfBounds[i] * (1 + RELATIVE_TOLERANCE)) {
                return i + 1;
            }
        }
        return 4;
    }

    @Override
    public String toString() {
        return "LopaPolicy{adequate=" + adequateGapRatio + ", marginal=" + marginalGapRatio
                + ", silRrfBounds=" + Arrays.toString(silRrfBounds) + "}";
    }

    private static boolean atLeast(double value, double threshold) {
        return value >= threshold * (1 - RELATIVE_TOLERANCE);
    }
}
