package hazop.risk.lopa;

/**
 * IEC 61511 low-demand PFD ranges. Lower bound inclusive, upper bound inclusive
 * for SIL 1 only, so a boundary PFD belongs to the lower SIL.
 */
public final class SilBand {
    private static final double[][] PFD_RANGES = {
            {0.01, 0.1},
            {0.001, 0.01},
            {0.0001, 0.001},
            {0.00001, 0.0001}
    };

    private SilBand() {
    }

    /**
     * @return the SIL whose PFD band contains {@code pfd}, or null when the PFD is
     * too high (or too low) for any SIL
     */
    public static Integer fromPfd(double pfd) {
        for (int i = 0; i < PFD_RANGES.length; i++) {
            double min = PFD_RANGES[i][0];
            double max = PFD_RANGES[i][1];
            boolean upperOk = i == 0 ? pfd <= max : pfd < max;
            if (pfd >= min && upperOk) {
                return i + 1;
            }
        }
        return null;
    }

    public static Double maxPfd(int sil) {
        if (sil < 1 || sil > PFD_RANGES.length) {
            return null;
        }
        return PFD_RANGES[sil - 1][1];
    }
}
