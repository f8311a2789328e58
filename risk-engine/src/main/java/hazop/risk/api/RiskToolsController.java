package hazop.risk.api;

import hazop.risk.api.model.ApiResponse;
import hazop.risk.api.model.RiskMatrixRequest;
import hazop.risk.api.model.ScoreRequest;
import hazop.risk.lopa.GapAnalysis;
import hazop.risk.lopa.GapScenario;
import hazop.risk.matrix.ImageRendering;
import hazop.risk.matrix.SvgRendering;
import hazop.risk.service.RiskToolsService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RiskToolsController {
    static final MediaType SVG = MediaType.parseMediaType("image/svg+xml");

    private final RiskToolsService service;

    public RiskToolsController(RiskToolsService service) {
        this.service = service;
    }

    @PostMapping("/risk-entries/score")
    public ResponseEntity<ApiResponse<RiskToolsService.ScoredEntry>> score(@RequestBody ScoreRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(
                service.score(request.severity(), request.likelihood(), request.detectability())));
    }

    @PostMapping("/lopa/analyze")
    public ResponseEntity<ApiResponse<GapAnalysis>> analyze(@RequestBody GapScenario scenario) {
        return ResponseEntity.ok(ApiResponse.ok(service.analyzeGap(RequestIds.next(), scenario)));
    }

    @PostMapping("/risk-matrix/image")
    public ResponseEntity<byte[]> image(@RequestBody(required = false) RiskMatrixRequest request) {
        ImageRendering rendering = service.renderImage(RequestIds.next(), orEmpty(request).toOptions());
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(rendering.filename()).build().toString())
                .body(rendering.bytes());
    }

    @PostMapping("/risk-matrix/svg")
    public ResponseEntity<String> svg(@RequestBody(required = false) RiskMatrixRequest request) {
        SvgRendering rendering = service.renderSvg(RequestIds.next(), orEmpty(request).toOptions());
        return ResponseEntity.ok().contentType(SVG).body(rendering.markup());
    }

    private static RiskMatrixRequest orEmpty(RiskMatrixRequest request) {
        return request == null ? new RiskMatrixRequest(null, null, null, null, null, null, null) : request;
    }
}
