package hazop.risk.lopa;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GapAnalysis(
        String id,
        String nodeId,
        String scenario,
        String consequence,
        double initiatingEventFrequency,
        String initiatingEventCategory,
        String initiatingEventDescription,
        double targetFrequency,
        List<Ipl> ipls,
        List<IplCredit> iplCredits,
        double totalRrf,
        double requiredRrf,
        double gapRatio,
        GapStatus gapStatus,
        double mitigatedEventLikelihood,
        Integer requiredSil,
        List<String> recommendations,
        List<String> warnings
) {}
