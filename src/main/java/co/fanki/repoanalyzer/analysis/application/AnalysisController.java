package co.fanki.repoanalyzer.analysis.application;

import co.fanki.repoanalyzer.analysis.domain.RepositoryAnalysis;
import co.fanki.repoanalyzer.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for analyzing repository snapshots.
 *
 * <p>The caller posts the already ingested files; nothing is fetched or
 * stored by this service.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Repository Analysis",
        description = "Structural inference over repository snapshots")
public class AnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisController.class);

    private final RepositoryAnalysisService analysisService;

    /**
     * Creates a new AnalysisController.
     *
     * @param theAnalysisService the analysis service
     */
    public AnalysisController(
            final RepositoryAnalysisService theAnalysisService) {
        this.analysisService = theAnalysisService;
    }

    /**
     * Analyzes a repository snapshot.
     *
     * @param request the files to analyze
     * @return the analysis as JSON, or 400 with the error
     */
    @PostMapping
    @Operation(summary = "Analyze a repository snapshot",
            description = "Classifies languages, detects the stack,"
                    + " classifies folders, finds entry points and builds"
                    + " the dependency graph and execution flow.")
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {

        final List<FileInput> files = request == null ? null : request.files();
        LOG.info("Analysis requested for {} files",
                files == null ? 0 : files.size());

        try {
            final RepositoryAnalysis analysis =
                    analysisService.analyzeInputs(files);

            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(analysis.toJson());
        } catch (final DomainException e) {
            LOG.warn("Analysis failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    /**
     * Request body for an analysis.
     *
     * @param files the repository files
     */
    public record AnalyzeRequest(List<FileInput> files) {}
}
