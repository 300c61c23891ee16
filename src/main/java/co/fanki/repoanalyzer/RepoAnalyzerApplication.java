package co.fanki.repoanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Repository Analyzer Application.
 *
 * <p>Exposes the structural inference pipeline over HTTP: languages, stack,
 * folder roles, entry points, dependency graph and execution flow of a
 * repository snapshot.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class RepoAnalyzerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(RepoAnalyzerApplication.class, args);
    }

}
