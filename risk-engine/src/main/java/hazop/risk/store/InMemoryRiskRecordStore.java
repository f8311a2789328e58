package hazop.risk.store;

import hazop.risk.domain.RiskEntry;
import hazop.risk.lopa.GapScenario;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local store used when no external record store is wired in.
 */
@Component
@ConditionalOnProperty(prefix = "hazop.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRiskRecordStore implements RiskRecordStore {
    private final Map<UUID, ProjectRecord> projects = new ConcurrentHashMap<>();
    private final Map<UUID, AnalysisRecord> analyses = new ConcurrentHashMap<>();
    private final Map<UUID, List<RiskEntry>> entries = new ConcurrentHashMap<>();
    private final Map<UUID, List<GapScenario>> scenarios = new ConcurrentHashMap<>();

    public void putProject(ProjectRecord project) {
        projects.put(project.id(), project);
    }

    public void putAnalysis(AnalysisRecord analysis) {
        analyses.put(analysis.id(), analysis);
    }

    public void addEntry(UUID analysisId, RiskEntry entry) {
        entries.computeIfAbsent(analysisId, id -> new CopyOnWriteArrayList<>()).add(entry);
    }

    public void addGapScenario(UUID analysisId, GapScenario scenario) {
        scenarios.computeIfAbsent(analysisId, id -> new CopyOnWriteArrayList<>()).add(scenario);
    }

    public void clear() {
        projects.clear();
        analyses.clear();
        entries.clear();
        scenarios.clear();
    }

    @Override
    public Optional<AnalysisRecord> findAnalysis(UUID analysisId) {
        return Optional.ofNullable(analyses.get(analysisId));
    }

    @Override
    public Optional<ProjectRecord> findProject(UUID projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public List<AnalysisRecord> listAnalyses(UUID projectId) {
        List<AnalysisRecord> result = new ArrayList<>();
        for (AnalysisRecord analysis : analyses.values()) {
            if (analysis.projectId().equals(projectId)) {
                result.add(analysis);
            }
        }
        result.sort(Comparator.comparing(AnalysisRecord::id));
        return result;
    }

    @Override
    public List<RiskEntry> listEntries(UUID analysisId) {
        return List.copyOf(entries.getOrDefault(analysisId, List.of()));
    }

    @Override
    public List<GapScenario> listGapScenarios(UUID analysisId) {
        return List.copyOf(scenarios.getOrDefault(analysisId, List.of()));
    }
}
