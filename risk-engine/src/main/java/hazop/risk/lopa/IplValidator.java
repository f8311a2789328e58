package hazop.risk.lopa;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Credibility review of the protection layers of one scenario. Produces warnings
 * only; a layer with a doubtful PFD is still credited as declared.
 */
public final class IplValidator {
    private static final double ATYPICAL_RATIO = 10.0;

    private IplValidator() {
    }

    public static List<String> review(List<Ipl> ipls) {
        List<String> warnings = new ArrayList<>();
        for (Ipl ipl : ipls) {
            reviewLayer(ipl, warnings);
        }
        commonCause(ipls, warnings);
        return List.copyOf(warnings);
    }

    private static void reviewLayer(Ipl ipl, List<String> warnings) {
        IplType type = ipl.type();
        String label = "Layer '" + ipl.name() + "' (" + type.wireValue() + ")";
        double suggested = type.suggestedPfd(ipl.sil());
        boolean inRange = true;
        if (ipl.pfd() < type.minCreditablePfd()) {
            inRange = false;
            warnings.add(label + ": PFD " + ipl.pfd() + " is below the creditable minimum "
                    + type.minCreditablePfd() + " for this layer type and requires detailed justification"
                    + "; suggested PFD " + suggested + ".");
        } else if (ipl.pfd() > type.maxCreditablePfd()) {
            inRange = false;
            warnings.add(label + ": PFD " + ipl.pfd() + " exceeds the maximum creditable PFD "
                    + type.maxCreditablePfd() + "; suggested PFD " + suggested + ".");
        }
        double ratio = ipl.pfd() / type.typicalPfd();
        if (inRange && (ratio < 1 / ATYPICAL_RATIO || ratio > ATYPICAL_RATIO)) {
            warnings.add(label + ": PFD " + ipl.pfd() + " is atypical against the typical "
                    + type.typicalPfd() + " for this layer type.");
        }
        if (type == IplType.BASIC_PROCESS_CONTROL && ipl.pfd() < IplType.BASIC_PROCESS_CONTROL.typicalPfd()) {
            warnings.add(label + ": a basic process control layer is normally credited with no better than PFD "
                    + IplType.BASIC_PROCESS_CONTROL.typicalPfd() + ".");
        }
        if (type == IplType.SAFETY_INSTRUMENTED_FUNCTION) {
            if (ipl.sil() == null) {
                warnings.add(label + ": a safety instrumented function should declare its SIL.");
            } else if (ipl.sil() == 4) {
                warnings.add(label + ": SIL 4 is rarely used in the process industry; confirm the claim.");
            }
        }
    }

    private static void commonCause(List<Ipl> ipls, List<String> warnings) {
        Map<IplType, Integer> byType = new EnumMap<>(IplType.class);
        int humanResponse = 0;
        int dependent = 0;
        for (Ipl ipl : ipls) {
            byType.merge(ipl.type(), 1, Integer::sum);
            if (ipl.type().humanResponse()) {
                humanResponse++;
            }
            if (!ipl.independentOfOtherIpls()) {
                dependent++;
            }
        }
        byType.forEach((type, count) -> {
            if (count > 1) {
                warnings.add("Possible common cause failure: " + count + " layers of type "
                        + type.wireValue() + " are credited.");
            }
        });
        if (humanResponse > 1) {
            warnings.add("Possible common cause failure: " + humanResponse
                    + " layers rely on human response; operator actions are rarely independent.");
        }
        if (byType.containsKey(IplType.BASIC_PROCESS_CONTROL)
                && byType.containsKey(IplType.SAFETY_INSTRUMENTED_FUNCTION)) {
            warnings.add("Possible common cause failure: basic process control and a safety instrumented function"
                    + " are both credited; verify they do not share sensors, final elements or power supplies.");
        }
        if (dependent > 0) {
            warnings.add("Possible common cause failure: " + dependent
                    + " layer(s) are not independent of the other layers.");
        }
    }
}
