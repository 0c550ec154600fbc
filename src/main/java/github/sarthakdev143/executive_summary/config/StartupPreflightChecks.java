package github.sarthakdev143.executive_summary.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Component
@ConditionalOnProperty(name = "executive-summary.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);

    private final ExecutiveSummaryProperties properties;

    public StartupPreflightChecks(ExecutiveSummaryProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (Map.Entry<String, String> binary : properties.tools().byPropertyName().entrySet()) {
            checkBinary(binary.getKey(), binary.getValue());
        }
        checkTemplateDirectory();
    }

    private void checkBinary(String propertyName, String configuredBinary) {
        if (configuredBinary == null || configuredBinary.isBlank()) {
            throw new IllegalStateException(propertyName + " must name an executable.");
        }

        if (configuredBinary.contains(File.separator)) {
            Path binaryPath = Path.of(configuredBinary);
            if (!Files.isRegularFile(binaryPath)) {
                throw new IllegalStateException(
                        "Executable not found at " + binaryPath.toAbsolutePath()
                                + ". Set " + propertyName + " to a valid path.");
            }
            return;
        }

        if (findOnPath(configuredBinary) == null) {
            throw new IllegalStateException(
                    configuredBinary + " is not available on PATH. Install it or set " + propertyName + ".");
        }
    }

    private void checkTemplateDirectory() {
        Path templateDir = properties.templateDir();
        if (!Files.isDirectory(templateDir)) {
            // Templates are optional inputs; the stages that need them skip themselves.
            logger.warn("Template directory {} does not exist. Scene-based images will be skipped.",
                    templateDir.toAbsolutePath());
        }
    }

    Path findOnPath(String binaryName) {
        String pathVariable = System.getenv("PATH");
        if (pathVariable == null || pathVariable.isBlank()) {
            return null;
        }

        for (String directory : pathVariable.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            Path candidate = Path.of(directory).resolve(binaryName);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
