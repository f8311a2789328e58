package hazop.risk.api;

import hazop.risk.api.model.ApiResponse;
import hazop.risk.api.model.StandardInfo;
import hazop.risk.compliance.AnalysisComplianceStatus;
import hazop.risk.compliance.ProjectComplianceStatus;
import hazop.risk.compliance.StandardCatalog;
import hazop.risk.service.ComplianceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class ComplianceController {
    static final String USER_HEADER = "X-User-Id";

    private final ComplianceService service;
    private final StandardCatalog catalog;

    public ComplianceController(ComplianceService service, StandardCatalog catalog) {
        this.service = service;
        this.catalog = catalog;
    }

    @GetMapping("/analyses/{id}/compliance")
    public ResponseEntity<ApiResponse<AnalysisComplianceStatus>> analysisCompliance(
            @PathVariable("id") String id,
            @RequestParam(name = "standards", required = false) String standards,
            @RequestHeader(name = USER_HEADER, required = false) String userId
    ) {
        AnalysisComplianceStatus status = service.analysisCompliance(
                RequestIds.next(), userId, RequestIds.parseUuid(id, "Invalid analysis ID format"), standards);
        return ResponseEntity.ok(ApiResponse.ok(status));
    }

    @GetMapping("/projects/{id}/compliance")
    public ResponseEntity<ApiResponse<ProjectComplianceStatus>> projectCompliance(
            @PathVariable("id") String id,
            @RequestParam(name = "standards", required = false) String standards,
            @RequestHeader(name = USER_HEADER, required = false) String userId
    ) {
        ProjectComplianceStatus status = service.projectCompliance(
                RequestIds.next(), userId, RequestIds.parseUuid(id, "Invalid project ID format"), standards);
        return ResponseEntity.ok(ApiResponse.ok(status));
    }

    @GetMapping("/standards")
    public ResponseEntity<ApiResponse<List<StandardInfo>>> standards() {
        return ResponseEntity.ok(ApiResponse.ok(catalog.all().stream().map(StandardInfo::of).toList()));
    }
}
