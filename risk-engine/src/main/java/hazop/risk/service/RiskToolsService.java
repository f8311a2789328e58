package hazop.risk.service;

import hazop.risk.audit.ComplianceAuditLogger;
import hazop.risk.domain.LopaTrigger;
import hazop.risk.domain.RiskBand;
import hazop.risk.domain.RiskEntry;
import hazop.risk.domain.RiskEntryScorer;
import hazop.risk.domain.RiskScale;
import hazop.risk.lopa.GapAnalysis;
import hazop.risk.lopa.GapAnalyzer;
import hazop.risk.lopa.GapScenario;
import hazop.risk.matrix.ImageRendering;
import hazop.risk.matrix.MatrixOptions;
import hazop.risk.matrix.RiskMatrixRenderer;
import hazop.risk.matrix.SvgRendering;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Stateless calculators exposed over REST: entry scoring, LOPA gap analysis and
 * matrix rendering.
 */
@Service
public class RiskToolsService {
    private final RiskEntryScorer scorer;
    private final GapAnalyzer gapAnalyzer;
    private final RiskMatrixRenderer renderer;
    private final ComplianceAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    public RiskToolsService(
            RiskEntryScorer scorer,
            GapAnalyzer gapAnalyzer,
            RiskMatrixRenderer renderer,
            ComplianceAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this.scorer = scorer;
        this.gapAnalyzer = gapAnalyzer;
        this.renderer = renderer;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    public ScoredEntry score(Integer severity, Integer likelihood, Integer detectability) {
        int score = scorer.score(
                RiskScale.require("severity", severity),
                RiskScale.require("likelihood", likelihood),
                detectability
        );
        RiskEntry entry = new RiskEntry(null, null, null, null, null, null,
                null, null, null, null, severity, likelihood, detectability);
        return new ScoredEntry(score, scorer.band(score), scorer.lopaTrigger(entry));
    }

    public GapAnalysis analyzeGap(String requestId, GapScenario scenario) {
        long startNs = System.nanoTime();
        GapAnalysis analysis = gapAnalyzer.analyze(scenario);
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        Counter.builder("hazop_lopa_analysis_total")
                .tag("status", analysis.gapStatus().wireValue())
                .register(meterRegistry)
                .increment();
        auditLogger.logGapAnalysis(requestId, analysis, processingMs);
        return analysis;
    }

    public SvgRendering renderSvg(String requestId, MatrixOptions options) {
        long startNs = System.nanoTime();
        SvgRendering rendering = renderer.renderSvg(options);
        recordRender(requestId, "svg", options, rendering.width(), rendering.height(), startNs);
        return rendering;
    }

    public ImageRendering renderImage(String requestId, MatrixOptions options) {
        long startNs = System.nanoTime();
        ImageRendering rendering = renderer.renderImage(options);
        recordRender(requestId, "png", options, rendering.width(), rendering.height(), startNs);
        return rendering;
    }

    private void recordRender(String requestId, String format, MatrixOptions options, int width, int height, long startNs) {
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        Counter.builder("hazop_risk_matrix_render_total")
                .tag("format", format)
                .tag("size", options.size().wireValue())
                .register(meterRegistry)
                .increment();
        auditLogger.logMatrixRender(requestId, format, options.size().wireValue(), width, height, processingMs);
    }

    public record ScoredEntry(int score, RiskBand band, LopaTrigger lopa) {}
}
