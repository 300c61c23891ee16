package co.fanki.repoanalyzer.analysis.application;

import co.fanki.repoanalyzer.analysis.domain.AnalysisSettings;
import co.fanki.repoanalyzer.analysis.domain.ArchitecturePattern;
import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.analysis.domain.RepositoryAnalysis;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.EntryPointFinder;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.EntryPointSet;
import co.fanki.repoanalyzer.analysis.domain.flow.ExecutionFlow;
import co.fanki.repoanalyzer.analysis.domain.flow.FlowSynthesizer;
import co.fanki.repoanalyzer.analysis.domain.graph.DependencyGraph;
import co.fanki.repoanalyzer.analysis.domain.graph.DependencyGraphBuilder;
import co.fanki.repoanalyzer.analysis.domain.language.LanguageClassifier;
import co.fanki.repoanalyzer.analysis.domain.language.LanguageStats;
import co.fanki.repoanalyzer.analysis.domain.stack.StackDetector;
import co.fanki.repoanalyzer.analysis.domain.structure.FolderClassification;
import co.fanki.repoanalyzer.analysis.domain.structure.StructureClassifier;
import co.fanki.repoanalyzer.shared.DomainException;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Application service running the structural inference pipeline.
 *
 * <p>The language, stack, structure and entry point detectors only read
 * the file records, so they may run concurrently on a pool owned by the
 * single {@link #analyze} call. The dependency graph and the execution
 * flow are always built on the calling thread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RepositoryAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RepositoryAnalysisService.class);

    /** Error code logged for inbound records that cannot be analyzed. */
    static final String INVALID_RECORD = "INVALID_RECORD";

    private final AnalysisSettings settings;

    private final LanguageClassifier languageClassifier;

    private final StackDetector stackDetector;

    private final StructureClassifier structureClassifier;

    private final EntryPointFinder entryPointFinder;

    private final DependencyGraphBuilder graphBuilder;

    private final FlowSynthesizer flowSynthesizer;

    /**
     * Creates a new RepositoryAnalysisService.
     *
     * @param theSettings the analysis settings
     * @param theLanguageClassifier the language classifier
     * @param theStackDetector the stack detector
     * @param theStructureClassifier the structure classifier
     * @param theEntryPointFinder the entry point finder
     * @param theGraphBuilder the dependency graph builder
     * @param theFlowSynthesizer the flow synthesizer
     */
    public RepositoryAnalysisService(final AnalysisSettings theSettings,
            final LanguageClassifier theLanguageClassifier,
            final StackDetector theStackDetector,
            final StructureClassifier theStructureClassifier,
            final EntryPointFinder theEntryPointFinder,
            final DependencyGraphBuilder theGraphBuilder,
            final FlowSynthesizer theFlowSynthesizer) {
        this.settings = theSettings;
        this.languageClassifier = theLanguageClassifier;
        this.stackDetector = theStackDetector;
        this.structureClassifier = theStructureClassifier;
        this.entryPointFinder = theEntryPointFinder;
        this.graphBuilder = theGraphBuilder;
        this.flowSynthesizer = theFlowSynthesizer;
    }

    /**
     * Creates a service with the default detectors for the given settings.
     *
     * @param theSettings the analysis settings
     * @return the service
     */
    public static RepositoryAnalysisService withDefaults(
            final AnalysisSettings theSettings) {
        return new RepositoryAnalysisService(theSettings,
                new LanguageClassifier(),
                new StackDetector(),
                new StructureClassifier(theSettings),
                new EntryPointFinder(),
                new DependencyGraphBuilder(theSettings),
                new FlowSynthesizer(theSettings));
    }

    /**
     * Converts raw inbound files and analyzes the valid ones.
     *
     * <p>A file without a path is logged and skipped; the rest of the
     * snapshot is still analyzed.</p>
     *
     * @param inputs the raw files
     * @return the analysis of the accepted files
     * @throws DomainException if no file list was supplied
     */
    public RepositoryAnalysis analyzeInputs(final List<FileInput> inputs) {
        if (inputs == null) {
            throw new DomainException("A file list is required",
                    "INVALID_REQUEST");
        }

        final List<FileRecord> records = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            final FileInput input = inputs.get(i);
            if (input == null) {
                LOG.warn("[{}] Skipping record #{}: record is null",
                        INVALID_RECORD, i);
                continue;
            }
            try {
                records.add(FileRecord.of(input.path(), input.content()));
            } catch (final IllegalArgumentException e) {
                LOG.warn("[{}] Skipping record #{}: {}", INVALID_RECORD, i,
                        e.getMessage());
            }
        }

        if (records.size() < inputs.size()) {
            LOG.info("Accepted {} of {} inbound records", records.size(),
                    inputs.size());
        }
        return analyze(records);
    }

    /**
     * Runs the whole pipeline over a snapshot.
     *
     * @param files the file records
     * @return the repository analysis
     */
    public RepositoryAnalysis analyze(final List<FileRecord> files) {
        Preconditions.requireNonNull(files, "Files are required");

        LOG.info("Analyzing snapshot of {} files (parallel: {})",
                files.size(), settings.parallel());

        final Detections detections = settings.parallel()
                ? detectConcurrently(files)
                : detectSequentially(files);

        final DependencyGraph graph = graphBuilder.build(files);

        final ExecutionFlow flow = flowSynthesizer.synthesize(
                detections.entrypoints(), detections.folders(),
                detections.frameworks(), detections.databases(),
                detections.infrastructure());

        final ArchitecturePattern pattern = ArchitecturePattern.infer(
                detections.folders(), detections.frameworks());

        LOG.info("Analysis complete: primary language {}, {} frameworks,"
                        + " {} folders, pattern: {}",
                detections.languages().primaryLanguage(),
                detections.frameworks().size(),
                detections.folders().size(),
                pattern.description());

        return new RepositoryAnalysis(detections.languages(),
                detections.frameworks(), detections.databases(),
                detections.infrastructure(), detections.folders(),
                detections.entrypoints(), graph, flow, pattern);
    }

    private Detections detectSequentially(final List<FileRecord> files) {
        return new Detections(
                languageClassifier.aggregate(files),
                stackDetector.detectFrameworks(files),
                stackDetector.detectDatabases(files),
                stackDetector.detectInfrastructure(files),
                structureClassifier.classifyFolders(files),
                entryPointFinder.findEntrypoints(files));
    }

    private Detections detectConcurrently(final List<FileRecord> files) {
        final ExecutorService executor = Executors.newFixedThreadPool(
                settings.threads());
        try {
            final Future<LanguageStats> languages = executor.submit(
                    () -> languageClassifier.aggregate(files));
            final Future<List<String>> frameworks = executor.submit(
                    () -> stackDetector.detectFrameworks(files));
            final Future<List<String>> databases = executor.submit(
                    () -> stackDetector.detectDatabases(files));
            final Future<List<String>> infrastructure = executor.submit(
                    () -> stackDetector.detectInfrastructure(files));
            final Future<FolderClassification> folders = executor.submit(
                    () -> structureClassifier.classifyFolders(files));
            final Future<EntryPointSet> entrypoints = executor.submit(
                    () -> entryPointFinder.findEntrypoints(files));

            return new Detections(await(languages), await(frameworks),
                    await(databases), await(infrastructure), await(folders),
                    await(entrypoints));
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T> T await(final Future<T> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Analysis was interrupted",
                    "ANALYSIS_INTERRUPTED", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DomainException("Detector failed: " + cause.getMessage(),
                    "ANALYSIS_FAILED", cause);
        }
    }

    /** Output of the four independent detectors. */
    private record Detections(
            LanguageStats languages,
            List<String> frameworks,
            List<String> databases,
            List<String> infrastructure,
            FolderClassification folders,
            EntryPointSet entrypoints) {}

}
