package co.fanki.repoanalyzer.config;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for the repository analyzer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    /**
     * Reports that the analyzer accepts requests.
     *
     * @return "up" while the service is running
     */
    @GetMapping("/health")
    public String health() {
        return "up";
    }

}
