package hazop.risk.lopa;

import hazop.risk.error.FieldViolation;
import hazop.risk.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Layers of Protection Analysis for a single hazard scenario.
 */
@Component
public class GapAnalyzer {
    private final LopaPolicy policy;

    public GapAnalyzer(LopaPolicy policy) {
        this.policy = policy;
    }

    public GapAnalysis analyze(GapScenario scenario) {
        validate(scenario);

        List<IplCredit> credits = new ArrayList<>();
        double totalRrf = 1.0;
        for (Ipl ipl : scenario.ipls()) {
            boolean credited = ipl.creditable();
            if (credited) {
                totalRrf *= ipl.rrf();
            }
            credits.add(new IplCredit(ipl.name(), ipl.type(), ipl.pfd(), ipl.rrf(), credited));
        }

        double requiredRrf = scenario.initiatingEventFrequency() / scenario.targetFrequency();
        double gapRatio = totalRrf / requiredRrf;
        GapStatus status = policy.classify(gapRatio);
        double mitigated = scenario.initiatingEventFrequency() / totalRrf;

        Integer requiredSil = null;
        List<String> recommendations = List.of();
        if (status != GapStatus.ADEQUATE) {
            double additionalRrf = requiredRrf / totalRrf;
            requiredSil = policy.requiredSil(additionalRrf);
            recommendations = recommend(scenario, status, totalRrf, requiredRrf, gapRatio, additionalRrf, requiredSil);
        }

        return new GapAnalysis(
                scenario.id(),
                scenario.nodeId(),
                scenario.scenario(),
                scenario.consequence(),
                scenario.initiatingEventFrequency(),
                scenario.initiatingEventCategory(),
                scenario.initiatingEventDescription(),
                scenario.targetFrequency(),
                scenario.ipls(),
                List.copyOf(credits),
                totalRrf,
                requiredRrf,
                gapRatio,
                status,
                mitigated,
                requiredSil,
                recommendations,
                IplValidator.review(scenario.ipls())
        );
    }

    private static void validate(GapScenario scenario) {
        List<FieldViolation> violations = new ArrayList<>();
        if (!positiveFinite(scenario.initiatingEventFrequency())) {
            violations.add(new FieldViolation("initiatingEventFrequency",
                    "initiating event frequency must be a positive number, got " + scenario.initiatingEventFrequency()));
        }
        if (!positiveFinite(scenario.targetFrequency())) {
            violations.add(new FieldViolation("targetFrequency",
                    "target frequency must be a positive number, got " + scenario.targetFrequency()));
        }
        for (int i = 0; i < scenario.ipls().size(); i++) {
            Ipl ipl = scenario.ipls().get(i);
            String prefix = "ipls[" + i + "]";
            String label = "IPL " + (i + 1) + (ipl.name() == null ? "" : " (" + ipl.name() + ")");
            if (ipl.name() == null || ipl.name().isBlank()) {
                violations.add(new FieldViolation(prefix + ".name", label + ": name is required"));
            }
            if (ipl.type() == null) {
                violations.add(new FieldViolation(prefix + ".type", label + ": type is required"));
            }
            if (!(ipl.pfd() > 0 && ipl.pfd() <= 1)) {
                violations.add(new FieldViolation(prefix + ".pfd",
                        label + ": pfd must be in (0, 1], got " + ipl.pfd()));
            }
            if (ipl.sil() != null && (ipl.sil() < 1 || ipl.sil() > 4)) {
                violations.add(new FieldViolation(prefix + ".sil",
                        label + ": sil must be between 1 and 4, got " + ipl.sil()));
            }
        }
        if (!violations.isEmpty()) {
            String message = violations.size() == 1
                    ? violations.get(0).message()
                    : "Invalid LOPA scenario: " + violations.size() + " problems";
            throw new ValidationException(message, violations);
        }
    }

    private List<String> recommend(
            GapScenario scenario,
            GapStatus status,
            double totalRrf,
            double requiredRrf,
            double gapRatio,
            double additionalRrf,
            int requiredSil
    ) {
        List<String> out = new ArrayList<>();
        out.add(String.format(Locale.ROOT,
                "Protection is %s: credited RRF %s against required RRF %s (gap ratio %.2f).",
                status.wireValue(), formatRrf(totalRrf), formatRrf(requiredRrf), gapRatio));
        out.add(String.format(Locale.ROOT,
                "Provide an additional risk reduction factor of %s, e.g. a SIL %d safety instrumented function.",
                formatRrf(additionalRrf), requiredSil));
        for (Ipl ipl : scenario.ipls()) {
            if (!ipl.creditable()) {
                out.add("Layer '" + ipl.name() + "' is not credited because it is not independent of "
                        + (ipl.independentOfInitiator() ? "the other IPLs" : "the initiating event")
                        + "; verify its independence or replace it with an independent layer.");
            }
            if (ipl.type() == IplType.SAFETY_INSTRUMENTED_FUNCTION && ipl.sil() != null) {
                Integer achievable = SilBand.fromPfd(ipl.pfd());
                if (!ipl.sil().equals(achievable)) {
                    out.add("Layer '" + ipl.name() + "' claims SIL " + ipl.sil() + " but its PFD "
                            + ipl.pfd() + " corresponds to "
                            + (achievable == null ? "no SIL band" : "SIL " + achievable)
                            + "; reconcile the SIL claim with the verified PFD.");
                }
            }
        }
        if (status == GapStatus.MARGINAL) {
            out.add("Gap is marginal: consider adding an independent relief device or an alarm with "
                    + "operator response to close the remaining shortfall.");
        }
        out.add("Schedule a LOPA review once the additional protection layers are specified.");
        return List.copyOf(out);
    }

    static String formatRrf(double rrf) {
        if (rrf >= 1_000_000) {
            return String.format(Locale.ROOT, "%.1fM", rrf / 1_000_000);
        }
        if (rrf >= 1_000) {
            return String.format(Locale.ROOT, "%.1fK", rrf / 1_000);
        }
        return String.format(Locale.ROOT, "%.0f", rrf);
    }

    private static boolean positiveFinite(double value) {
        return value > 0 && Double.isFinite(value);
    }
}
