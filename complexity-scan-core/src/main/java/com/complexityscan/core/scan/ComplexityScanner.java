package com.complexityscan.core.scan;

import com.complexityscan.core.aggregate.ComplexityAccumulator;
import com.complexityscan.core.aggregate.RepositorySummary;
import com.complexityscan.core.config.AnalyzerConfig;
import com.complexityscan.core.discovery.DiscoveredFile;
import com.complexityscan.core.discovery.FileDiscovery;
import com.complexityscan.core.discovery.SkippedPaths;
import com.complexityscan.core.error.ErrorKind;
import com.complexityscan.core.error.ScanException;
import com.complexityscan.core.language.Grammar;
import com.complexityscan.core.language.LanguageProfile;
import com.complexityscan.core.language.LanguageRegistry;
import com.complexityscan.core.metrics.FileAnalyzer;
import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.model.ParseStatus;
import com.complexityscan.core.model.SourceFile;
import com.complexityscan.core.normalize.NodeClassifier;
import com.complexityscan.core.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a complete scan: discovery, parallel per-file analysis and reduction.
 *
 * <p>Each discovered file is one unit of work (read, parse, normalize, score) executed on
 * a fixed pool. Units share no mutable state; their results are folded into a
 * {@link ComplexityAccumulator} on the calling thread as they complete, so the summary
 * does not depend on worker count or completion order.
 *
 * <p>Per-file problems never abort a scan. An exception escaping one unit is downgraded
 * to a parse failure of that file. Only fatal conditions are thrown: a missing root and
 * the global timeout.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComplexityScanner scanner = new ComplexityScanner(LanguageRegistry.fromClasspath(), AnalyzerConfig.defaults());
 * ScanResult result = scanner.scan(Path.of("/src/project"));
 * long total = result.summary().totalCyclomaticComplexity();
 * }</pre>
 */
public class ComplexityScanner {

    private static final Logger log = LoggerFactory.getLogger(ComplexityScanner.class);

    // queued units per worker before discovery waits for results
    private static final int MAX_IN_FLIGHT_PER_WORKER = 32;

    private final LanguageRegistry registry;
    private final AnalyzerConfig config;
    private final Duration timeout;
    private final Map<String, LanguageUnit> analyzers = new ConcurrentHashMap<>();

    public ComplexityScanner(LanguageRegistry registry, AnalyzerConfig config) {
        this(registry, config, Duration.ofSeconds(config.timeoutSeconds()));
    }

    /**
     * Creates a scanner with an explicit time limit instead of the configured one.
     *
     * @param registry language registry
     * @param config analyzer configuration
     * @param timeout wall-clock limit of a whole scan
     */
    public ComplexityScanner(LanguageRegistry registry, AnalyzerConfig config, Duration timeout) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Scans a directory tree.
     *
     * @param root directory to scan
     * @return scan result
     * @throws ScanException {@link ErrorKind#ROOT_NOT_FOUND} if the root is not a directory,
     *         {@link ErrorKind#TIMEOUT} if the scan exceeds the configured time limit,
     *         {@link ErrorKind#INTERNAL_INVARIANT_VIOLATION} if the reduction is inconsistent
     */
    public ScanResult scan(Path root) {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + timeout.toNanos();
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new ScanException(ErrorKind.ROOT_NOT_FOUND, "Root directory not found: " + root);
        }

        int workers = config.effectiveWorkers();
        log.info("Scanning {} with {} workers", normalizedRoot, workers);

        SkippedPaths skipped = new SkippedPaths();
        FileDiscovery discovery = FileDiscovery.create(normalizedRoot, registry, config, skipped)
            .onProgress(() -> checkDeadline(deadlineNanos, timeout));
        Set<String> scannedLanguages = new TreeSet<>();
        ComplexityAccumulator total = ComplexityAccumulator.empty(config.topN(), config.includeFiles());
        ScanStatistics.Builder statistics = new ScanStatistics.Builder();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        CompletionService<UnitResult> completion = new ExecutorCompletionService<>(pool);
        int submitted = 0;
        int completed = 0;
        try {
            Iterator<DiscoveredFile> files = discovery.stream().iterator();
            while (files.hasNext()) {
                checkDeadline(deadlineNanos, timeout);
                DiscoveredFile file = files.next();
                statistics.incrementFilesDiscovered();
                scannedLanguages.add(file.language().id());
                completion.submit(() -> analyzeUnit(file));
                submitted++;

                Future<UnitResult> done;
                while ((done = completion.poll()) != null) {
                    fold(done, total, statistics);
                    completed++;
                }
                if (submitted - completed >= workers * MAX_IN_FLIGHT_PER_WORKER) {
                    fold(awaitNext(completion, deadlineNanos, timeout), total, statistics);
                    completed++;
                }
            }
            log.debug("Discovery finished: {} files submitted", submitted);
            while (completed < submitted) {
                fold(awaitNext(completion, deadlineNanos, timeout), total, statistics);
                completed++;
            }
            checkDeadline(deadlineNanos, timeout);
        } finally {
            pool.shutdownNow();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        RepositorySummary summary = total.toSummary(config.thresholds(), elapsedMs);
        ScanStatistics stats = statistics
            .filesSkippedBinary(skipped.binary())
            .filesSkippedUnrecognized(skipped.unrecognized())
            .pathsPermissionDenied(skipped.permissionDenied())
            .build();

        log.info("Scan of {} completed in {} ms: {} files, {} functions, total complexity {} ({})",
            normalizedRoot, elapsedMs, summary.totalFiles(), summary.totalFunctions(),
            summary.totalCyclomaticComplexity(), summary.bucket().label());
        log.info(stats.getSummary());

        return new ScanResult(root.toString(), summary, skipped, grammarVersions(scannedLanguages), stats);
    }

    private SortedMap<String, String> grammarVersions(Set<String> languageIds) {
        SortedMap<String, String> versions = new TreeMap<>();
        for (String id : languageIds) {
            Grammar grammar = registry.grammarFor(id);
            if (grammar.isAvailable()) {
                versions.put(id, grammar.profile().grammarVersion());
            }
        }
        return versions;
    }

    private UnitResult analyzeUnit(DiscoveredFile file) {
        LanguageUnit unit = unitFor(file.language());
        try {
            byte[] content = Files.readAllBytes(file.path());
            FileMetrics metrics = unit.analyzer().analyze(file.relativePath(), content);
            ErrorKind kind = unit.grammarAvailable() ? ErrorKind.PARSE_FAILURE : ErrorKind.UNSUPPORTED_LANGUAGE;
            return new UnitResult(metrics, metrics.source().status().isSuccess() ? null : kind);
        } catch (AccessDeniedException e) {
            log.warn("Permission denied reading {}", file.relativePath());
            return failedUnit(file, "permission denied", ErrorKind.PERMISSION_DENIED);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file.relativePath(), e.getMessage());
            return failedUnit(file, "read error: " + e.getMessage(), ErrorKind.PARSE_FAILURE);
        } catch (RuntimeException | LinkageError | StackOverflowError e) {
            log.warn("Unexpected error analyzing {}; recorded as a parse failure", file.relativePath(), e);
            return failedUnit(file, "internal error: " + e, ErrorKind.PARSE_FAILURE);
        }
    }

    private static UnitResult failedUnit(DiscoveredFile file, String reason, ErrorKind kind) {
        SourceFile source = new SourceFile(file.relativePath(), file.language().id(), file.sizeBytes(), "",
            ParseStatus.failure(reason));
        return new UnitResult(FileMetrics.failed(source), kind);
    }

    private LanguageUnit unitFor(LanguageProfile profile) {
        return analyzers.computeIfAbsent(profile.id(), id -> {
            Grammar grammar = registry.grammarFor(id);
            FileAnalyzer analyzer = new FileAnalyzer(new NodeClassifier(profile), createParser(grammar));
            return new LanguageUnit(analyzer, grammar.isAvailable());
        });
    }

    /**
     * Creates the parser used for every file of one language in this scanner.
     *
     * @param grammar grammar handle from the registry, possibly unavailable
     * @return parser for that language
     */
    protected SourceParser createParser(Grammar grammar) {
        return SourceParser.forGrammar(grammar, config.failOnSyntaxErrors());
    }

    private void fold(Future<UnitResult> done, ComplexityAccumulator total, ScanStatistics.Builder statistics) {
        UnitResult result;
        try {
            result = done.get();
        } catch (ExecutionException e) {
            throw new ScanException(ErrorKind.INTERNAL_INVARIANT_VIOLATION,
                "Unit of work failed outside its error boundary", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException(ErrorKind.TIMEOUT, "Scan interrupted", e);
        }

        FileMetrics metrics = result.metrics();
        total.absorb(ComplexityAccumulator.of(metrics, config.topN(), config.includeFiles()));
        if (metrics.source().status().isSuccess()) {
            statistics.incrementFilesParsed();
        } else {
            statistics.incrementFilesFailed();
            statistics.addError(result.errorKind(), metrics.path() + ": " + metrics.source().status().reason());
        }
    }

    private static Future<UnitResult> awaitNext(CompletionService<UnitResult> completion, long deadlineNanos,
                                                Duration limit) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw timeout(limit);
        }
        try {
            Future<UnitResult> next = completion.poll(remaining, TimeUnit.NANOSECONDS);
            if (next == null) {
                throw timeout(limit);
            }
            return next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException(ErrorKind.TIMEOUT, "Scan interrupted", e);
        }
    }

    private static void checkDeadline(long deadlineNanos, Duration limit) {
        if (System.nanoTime() - deadlineNanos >= 0) {
            throw timeout(limit);
        }
    }

    private static ScanException timeout(Duration limit) {
        return new ScanException(ErrorKind.TIMEOUT, "Scan exceeded the time limit of " + limit.toMillis() + " ms");
    }

    private record LanguageUnit(FileAnalyzer analyzer, boolean grammarAvailable) {}

    private record UnitResult(FileMetrics metrics, ErrorKind errorKind) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threads = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "complexity-scan-" + pool + "-worker-" + threads.incrementAndGet());
            // a grammar stuck in native code must not keep the JVM alive after a timeout
            thread.setDaemon(true);
            return thread;
        }
    }
}
