package hazop.risk.lopa;

import java.util.List;

public record GapScenario(
        String id,
        String nodeId,
        String scenario,
        String consequence,
        double initiatingEventFrequency,
        String initiatingEventCategory,
        String initiatingEventDescription,
        double targetFrequency,
        List<Ipl> ipls
) {
    public GapScenario {
        ipls = ipls == null ? List.of() : List.copyOf(ipls);
    }
}
