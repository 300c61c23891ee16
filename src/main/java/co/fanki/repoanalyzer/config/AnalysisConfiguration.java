package co.fanki.repoanalyzer.config;

import co.fanki.repoanalyzer.analysis.domain.AnalysisSettings;
import co.fanki.repoanalyzer.analysis.domain.entrypoint.EntryPointFinder;
import co.fanki.repoanalyzer.analysis.domain.flow.FlowSynthesizer;
import co.fanki.repoanalyzer.analysis.domain.graph.DependencyGraphBuilder;
import co.fanki.repoanalyzer.analysis.domain.language.LanguageClassifier;
import co.fanki.repoanalyzer.analysis.domain.stack.StackDetector;
import co.fanki.repoanalyzer.analysis.domain.structure.StructureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the analysis settings and the pipeline components.
 *
 * <p>Detectors never read configuration themselves; they receive the
 * {@link AnalysisSettings} assembled here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisConfiguration.class);

    @Value("${repo-analyzer.structure.min-dominant-files:2}")
    private int minDominantFiles;

    @Value("${repo-analyzer.structure.majority-ratio:0.5}")
    private double majorityRatio;

    @Value("${repo-analyzer.graph.partial-match:true}")
    private boolean partialMatch;

    @Value("${repo-analyzer.flow.max-entry-components:5}")
    private int maxEntryComponents;

    @Value("${repo-analyzer.flow.min-middleware-folders:2}")
    private int minMiddlewareFolders;

    @Value("${repo-analyzer.pipeline.parallel:false}")
    private boolean parallel;

    @Value("${repo-analyzer.pipeline.threads:4}")
    private int threads;

    /**
     * Creates the analysis settings from the configured properties.
     *
     * @return the settings
     */
    @Bean
    public AnalysisSettings analysisSettings() {
        final AnalysisSettings settings = new AnalysisSettings(
                minDominantFiles, majorityRatio, partialMatch,
                maxEntryComponents, minMiddlewareFolders, parallel, threads);
        LOG.info("Analysis settings: {}", settings);
        return settings;
    }

    @Bean
    public LanguageClassifier languageClassifier() {
        return new LanguageClassifier();
    }

    @Bean
    public StackDetector stackDetector() {
        return new StackDetector();
    }

    @Bean
    public StructureClassifier structureClassifier(
            final AnalysisSettings settings) {
        return new StructureClassifier(settings);
    }

    @Bean
    public EntryPointFinder entryPointFinder() {
        return new EntryPointFinder();
    }

    @Bean
    public DependencyGraphBuilder dependencyGraphBuilder(
            final AnalysisSettings settings) {
        return new DependencyGraphBuilder(settings);
    }

    @Bean
    public FlowSynthesizer flowSynthesizer(final AnalysisSettings settings) {
        return new FlowSynthesizer(settings);
    }

}
