package co.fanki.repoanalyzer.analysis.domain.graph;

import co.fanki.repoanalyzer.analysis.domain.AnalysisSettings;
import co.fanki.repoanalyzer.analysis.domain.FileRecord;
import co.fanki.repoanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the file-level {@link DependencyGraph} of a snapshot.
 *
 * <p>Every file with content becomes a node. Imports are read by the
 * first {@link ImportExtractor} that supports the file and resolved
 * against all snapshot paths, content-less files included, so an edge
 * may point at a file that has no content of its own.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DependencyGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyGraphBuilder.class);

    private final AnalysisSettings settings;

    private final List<ImportExtractor> extractors;

    /**
     * Creates a builder with the Python and JavaScript extractors.
     *
     * @param theSettings the analysis settings
     */
    public DependencyGraphBuilder(final AnalysisSettings theSettings) {
        this(theSettings, List.of(new PythonImportExtractor(),
                new JavaScriptImportExtractor()));
    }

    /**
     * Creates a builder with custom extractors.
     *
     * @param theSettings the analysis settings
     * @param theExtractors the extractors, first supporting one wins
     */
    public DependencyGraphBuilder(final AnalysisSettings theSettings,
            final List<ImportExtractor> theExtractors) {
        this.settings = Preconditions.requireNonNull(theSettings,
                "Settings are required");
        this.extractors = List.copyOf(Preconditions.requireNonNull(
                theExtractors, "Extractors are required"));
    }

    /**
     * Builds the dependency graph of the given files.
     *
     * @param files the file records
     * @return the graph, empty when no file has content
     */
    public DependencyGraph build(final List<FileRecord> files) {
        Preconditions.requireNonNull(files, "Files are required");

        final List<String> allPaths = new ArrayList<>();
        for (final FileRecord file : files) {
            allPaths.add(file.path());
        }
        final ModuleResolver resolver = new ModuleResolver(allPaths,
                settings.partialImportMatch());

        final DependencyGraph graph = new DependencyGraph();

        for (final FileRecord file : files) {
            if (!file.hasContent()) {
                continue;
            }
            graph.addNode(file.path());

            final Optional<ImportExtractor> extractor = extractorFor(file);
            if (extractor.isEmpty()) {
                continue;
            }

            for (final String identifier : extractor.get().extract(file)) {
                resolver.resolve(identifier)
                        .filter(target -> !target.equals(file.path()))
                        .ifPresent(target -> graph.addEdge(file.path(),
                                target));
            }
        }

        LOG.info("Dependency graph built: {} nodes, {} edges",
                graph.nodeCount(), graph.edgeCount());

        return graph;
    }

    private Optional<ImportExtractor> extractorFor(final FileRecord file) {
        for (final ImportExtractor extractor : extractors) {
            if (extractor.supports(file)) {
                return Optional.of(extractor);
            }
        }
        return Optional.empty();
    }

}
