package co.fanki.repoanalyzer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Repository Analyzer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Describes the analyzer API.
     *
     * @return the OpenAPI document root
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Repository Analyzer API")
                        .description("""
                                Repository Analyzer - infers the structure of a repository
                                snapshot from its file paths and contents.

                                ## Output
                                - **Languages**: per-language file and line counts
                                - **Stack**: frameworks, data stores and infrastructure
                                - **Structure**: top-level folder roles
                                - **Entry points**: entry files, framework bootstraps, Docker commands
                                - **Dependency graph**: file-level import edges
                                - **Execution flow**: layered stages and their connections
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
