package com.complexityscan.cli;

import com.complexityscan.ComplexityScanCLI;
import com.complexityscan.core.aggregate.RepositorySummary;
import com.complexityscan.core.config.AnalyzerConfig;
import com.complexityscan.core.config.ConfigLoader;
import com.complexityscan.core.error.ScanException;
import com.complexityscan.core.language.LanguageRegistry;
import com.complexityscan.core.renderer.OutputRenderer;
import com.complexityscan.core.renderer.RenderContext;
import com.complexityscan.core.renderer.RenderedReport;
import com.complexityscan.core.report.JsonReportEmitter;
import com.complexityscan.core.report.ScanReport;
import com.complexityscan.core.scan.ComplexityScanner;
import com.complexityscan.core.scan.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to scan a directory and emit the complexity report.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code complexity-scan.yaml} (or {@code --config}) and apply flag overrides</li>
 *   <li>Discover, parse and measure every recognized source file</li>
 *   <li>Serialize the repository summary as JSON</li>
 *   <li>Hand the JSON to the {@code console} or {@code filesystem} renderer</li>
 * </ol>
 *
 * <p>The report is the only thing written to standard output. A short human summary
 * goes to standard error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * complexity-scan scan
 *
 * # Scan with 4 workers, 60 second limit, report to file
 * complexity-scan scan /path/to/repo -w 4 -t 60 -o report.json
 *
 * # Extra ignore patterns
 * complexity-scan scan . -i 'generated/' -i '*.pb.go'
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan a directory and emit a JSON complexity report",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ComplexityScanCLI.EXIT_USAGE
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Directory to scan (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(names = {"-o", "--output"}, description = "Write the report to this file instead of stdout")
    private Path outputFile;

    @Option(names = {"--include-files"}, description = "Include per-file metrics in the report")
    private boolean includeFiles;

    @Option(names = {"-w", "--workers"}, description = "Worker threads (default: available processors)")
    private Integer workers;

    @Option(names = {"-t", "--timeout"}, description = "Scan time limit in seconds (default: 300)")
    private Long timeoutSeconds;

    @Option(names = {"-n", "--top"}, description = "Number of top complex functions to report (default: 10)")
    private Integer topN;

    @Option(names = {"-i", "--ignore"}, description = "Additional gitignore-style pattern (repeatable)")
    private List<String> ignorePatterns = new ArrayList<>();

    @Option(names = {"--include-hidden"}, description = "Descend into hidden files and directories")
    private boolean includeHidden;

    @Option(names = {"--no-gitignore"}, description = "Do not honor the root .gitignore")
    private boolean noGitignore;

    @Option(names = {"--no-default-ignores"}, description = "Do not apply the built-in ignore patterns")
    private boolean noDefaultIgnores;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: <path>/complexity-scan.yaml)")
    private Path configPath;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            log.info("Starting scan of: {}", root);

            AnalyzerConfig config = loadConfiguration(root);
            ComplexityScanner scanner = new ComplexityScanner(LanguageRegistry.fromClasspath(), config);
            ScanResult result = scanner.scan(root);

            ScanReport report = ScanReport.from(result, config.includeFiles());
            String json = new JsonReportEmitter().toJson(report);
            renderOutput(RenderedReport.json(json));

            printSummary(err, result);
            return ComplexityScanCLI.EXIT_OK;

        } catch (ScanException e) {
            log.error("Scan failed: {}", e.getMessage());
            err.println("Scan failed: " + e.getMessage());
            err.flush();
            return switch (e.getKind()) {
                case ROOT_NOT_FOUND -> ComplexityScanCLI.EXIT_ROOT_NOT_FOUND;
                case TIMEOUT -> ComplexityScanCLI.EXIT_TIMEOUT;
                default -> ComplexityScanCLI.EXIT_FAILURE;
            };
        } catch (RuntimeException e) {
            log.error("Scan failed", e);
            err.println("Scan failed: " + e.getMessage());
            err.flush();
            return ComplexityScanCLI.EXIT_FAILURE;
        }
    }

    /**
     * Loads configuration and applies command-line overrides.
     */
    AnalyzerConfig loadConfiguration(Path root) {
        Path explicit = configPath == null ? null : configPath.toAbsolutePath();
        AnalyzerConfig fileConfig = ConfigLoader.loadForRoot(root, explicit);

        AnalyzerConfig.Builder builder = fileConfig.toBuilder().addIgnorePatterns(ignorePatterns);
        if (workers != null) {
            builder.workers(workers);
        }
        if (timeoutSeconds != null) {
            builder.timeoutSeconds(timeoutSeconds);
        }
        if (topN != null) {
            builder.topN(topN);
        }
        if (includeHidden) {
            builder.includeHidden(true);
        }
        if (noGitignore) {
            builder.respectGitignore(false);
        }
        if (noDefaultIgnores) {
            builder.useDefaultIgnores(false);
        }
        if (includeFiles) {
            builder.includeFiles(true);
        }
        AnalyzerConfig config = builder.build();
        log.debug("Effective configuration: {}", config);
        return config;
    }

    private void renderOutput(RenderedReport report) {
        String rendererId = outputFile == null ? "console" : "filesystem";
        OutputRenderer renderer = findRenderer(rendererId);
        RenderContext context = outputFile == null
            ? RenderContext.console(spec.commandLine().getOut())
            : RenderContext.file(outputFile.toAbsolutePath().toString());
        renderer.render(report, context);
    }

    private static OutputRenderer findRenderer(String rendererId) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(rendererId)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No output renderer registered with id: " + rendererId);
    }

    private void printSummary(PrintWriter err, ScanResult result) {
        RepositorySummary summary = result.summary();
        err.println();
        err.println("Complexity Summary:");
        err.printf("  Files:            %d (%d parsed, %d failed)%n",
            summary.totalFiles(), summary.parsedFiles(), summary.failedFiles());
        err.printf("  Functions:        %d%n", summary.totalFunctions());
        err.printf("  Total complexity: %d (%s)%n",
            summary.totalCyclomaticComplexity(), summary.bucket().label());
        err.printf("  Avg complexity:   %.2f%n", summary.avgCyclomaticComplexity());
        err.printf("  Scan time:        %d ms%n", summary.scanTimeMs());
        if (outputFile != null) {
            err.println("  Report:           " + outputFile.toAbsolutePath());
        }
        err.flush();
    }
}
