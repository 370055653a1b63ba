package eu.virtualparadox.comunex.application.config;

import eu.virtualparadox.comunex.query.IndicatorRequest;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level settings of a run: which municipality is processed, where its workspace lives,
 * which years are targeted and which indicators are resolved.
 */
@Configuration
@ConfigurationProperties(prefix = "comunex")
@Getter @Setter
public class ApplicationConfig {

    private Path root = Path.of("data");
    private String comune = "comune";
    private String baseUrl;
    private List<Integer> years = new ArrayList<>();
    private Path output;
    private boolean runOnStartup;
    private Index index = new Index();
    private List<IndicatorRequest> indicators = new ArrayList<>();

    @Bean
    public WorkspaceLayout workspaceLayout() {
        return new WorkspaceLayout(root, comune);
    }

    /**
     * Directory receiving {@code sources.json}, {@code queries.json} and the run report.
     */
    public Path resolveOutput() {
        return output != null ? output : workspaceLayout().comuneDir().resolve("output");
    }

    @Getter @Setter
    public static class Index {
        /** Ignore persisted index artifacts and rebuild from the catalog. */
        private boolean rebuild;
    }

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (output != null) Files.createDirectories(output);
    }
}
