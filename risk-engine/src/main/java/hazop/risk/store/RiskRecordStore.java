package hazop.risk.store;

import hazop.risk.domain.RiskEntry;
import hazop.risk.lopa.GapScenario;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the analysis workflow's records. Every call returns the
 * state at call time; callers must not assume two calls see the same data.
 */
public interface RiskRecordStore {
    Optional<AnalysisRecord> findAnalysis(UUID analysisId);

    Optional<ProjectRecord> findProject(UUID projectId);

    List<AnalysisRecord> listAnalyses(UUID projectId);

    List<RiskEntry> listEntries(UUID analysisId);

    List<GapScenario> listGapScenarios(UUID analysisId);
}
