package com.complexityscan.core.discovery;

import com.complexityscan.core.config.AnalyzerConfig;
import com.complexityscan.core.error.ErrorKind;
import com.complexityscan.core.error.ScanException;
import com.complexityscan.core.language.LanguageProfile;
import com.complexityscan.core.language.LanguageRegistry;
import com.complexityscan.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a source tree and yields the files worth analyzing.
 *
 * <p>The walk is lazy: directories are listed only as the sequence is consumed, so the
 * scheduler can start parsing before the walk is complete. The sequence is finite and
 * can be consumed once.
 *
 * <p><b>Filtering, in order:</b>
 * <ol>
 *   <li>VCS metadata directories ({@code .git}, {@code .hg}, ...) are always excluded</li>
 *   <li>hidden entries are excluded unless requested</li>
 *   <li>gitignore-style rules ({@link IgnoreRules})</li>
 *   <li>unrecognized extensions are tallied and excluded</li>
 *   <li>oversized and binary files are tallied and excluded</li>
 * </ol>
 *
 * <p>Unreadable directories are recorded and skipped; the walk goes on. Symlinks are
 * followed, and a directory whose real path was already visited is skipped as a cycle.
 */
public class FileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(FileDiscovery.class);

    /**
     * Directory names that are never descended into.
     */
    public static final Set<String> VCS_DIRECTORIES = Set.of(".git", ".hg", ".svn", ".bzr", "_darcs", "CVS");

    private final Path root;
    private final LanguageRegistry registry;
    private final IgnoreRules ignoreRules;
    private final boolean includeHidden;
    private final long maxFileBytes;
    private final SkippedPaths skipped;
    private final AtomicBoolean consumed = new AtomicBoolean();
    private Runnable progressCheck = () -> { };

    public FileDiscovery(Path root, LanguageRegistry registry, IgnoreRules ignoreRules,
                         boolean includeHidden, long maxFileBytes, SkippedPaths skipped) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.ignoreRules = Objects.requireNonNull(ignoreRules, "ignoreRules must not be null");
        this.includeHidden = includeHidden;
        this.maxFileBytes = maxFileBytes;
        this.skipped = Objects.requireNonNull(skipped, "skipped must not be null");
    }

    /**
     * Creates a discovery for a root using the ignore settings of a configuration.
     *
     * @param root scan root
     * @param registry language registry
     * @param config analyzer configuration
     * @param skipped tally receiving skip records
     * @return discovery over the root
     */
    public static FileDiscovery create(Path root, LanguageRegistry registry, AnalyzerConfig config,
                                       SkippedPaths skipped) {
        IgnoreRules rules = IgnoreRules.forRoot(root, config.useDefaultIgnores(), config.respectGitignore(),
            config.ignorePatterns());
        return new FileDiscovery(root, registry, rules, config.includeHidden(), config.maxFileBytes(), skipped);
    }

    /**
     * Registers a check run before each directory listing and each directory entry.
     *
     * <p>The check may abort the walk by throwing; the exception propagates out of the
     * stream. The scanner uses this to enforce its deadline while the walk yields nothing.
     *
     * @param check callback, typically a deadline check
     * @return this discovery
     */
    public FileDiscovery onProgress(Runnable check) {
        this.progressCheck = Objects.requireNonNull(check, "check must not be null");
        return this;
    }

    public Path root() {
        return root;
    }

    /**
     * Returns the lazy sequence of candidate files.
     *
     * @return stream of discovered files, sorted by path within each directory
     * @throws ScanException with {@link ErrorKind#ROOT_NOT_FOUND} if the root is not a directory
     * @throws IllegalStateException if called a second time
     */
    public Stream<DiscoveredFile> stream() {
        if (!Files.isDirectory(root)) {
            throw new ScanException(ErrorKind.ROOT_NOT_FOUND, "Root directory not found: " + root);
        }
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("File discovery of " + root + " has already been consumed");
        }
        Iterator<DiscoveredFile> iterator = new Walker();
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private final class Walker implements Iterator<DiscoveredFile> {

        private final Deque<Path> pendingDirectories = new ArrayDeque<>();
        private final Deque<DiscoveredFile> ready = new ArrayDeque<>();
        private final Set<Path> visitedDirectories = new HashSet<>();

        Walker() {
            pendingDirectories.push(root);
            try {
                visitedDirectories.add(root.toRealPath());
            } catch (IOException e) {
                visitedDirectories.add(root);
            }
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !pendingDirectories.isEmpty()) {
                expand(pendingDirectories.pop());
            }
            return !ready.isEmpty();
        }

        @Override
        public DiscoveredFile next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        private void expand(Path directory) {
            progressCheck.run();
            List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                stream.forEach(entries::add);
            } catch (AccessDeniedException e) {
                log.warn("Permission denied, skipping directory: {}", directory);
                skipped.recordPermissionDenied(relative(directory));
                return;
            } catch (IOException e) {
                log.warn("Cannot list directory {}: {}. Skipping.", directory, e.getMessage());
                skipped.recordPermissionDenied(relative(directory));
                return;
            }
            entries.sort(Comparator.comparing(p -> p.getFileName().toString()));

            List<Path> subdirectories = new ArrayList<>();
            for (Path entry : entries) {
                progressCheck.run();
                String name = entry.getFileName().toString();
                String relativePath = relative(entry);
                boolean isDirectory = Files.isDirectory(entry);

                if (isDirectory && VCS_DIRECTORIES.contains(name)) {
                    continue;
                }
                if (!includeHidden && FileUtils.isHidden(entry)) {
                    continue;
                }
                if (ignoreRules.isIgnored(relativePath, isDirectory)) {
                    log.trace("Ignored: {}", relativePath);
                    skipped.recordIgnored();
                    continue;
                }
                if (isDirectory) {
                    if (markVisited(entry, relativePath)) {
                        subdirectories.add(entry);
                    }
                } else if (Files.isRegularFile(entry)) {
                    consider(entry, relativePath);
                }
            }
            for (int i = subdirectories.size() - 1; i >= 0; i--) {
                pendingDirectories.push(subdirectories.get(i));
            }
        }

        private boolean markVisited(Path directory, String relativePath) {
            Path realPath;
            try {
                realPath = directory.toRealPath();
            } catch (IOException e) {
                log.warn("Cannot resolve {}: {}. Skipping.", directory, e.getMessage());
                return false;
            }
            if (!visitedDirectories.add(realPath)) {
                log.warn("Symlink cycle detected, skipping: {} -> {}", relativePath, realPath);
                skipped.recordSymlinkCycle(relativePath);
                return false;
            }
            return true;
        }

        private void consider(Path file, String relativePath) {
            Optional<LanguageProfile> language = registry.resolve(file);
            if (language.isEmpty()) {
                skipped.recordUnrecognized(FileUtils.getExtension(file));
                return;
            }
            try {
                long size = Files.size(file);
                if (size > maxFileBytes) {
                    log.debug("Skipping {} ({} bytes exceeds {})", relativePath, size, maxFileBytes);
                    skipped.recordBinary(relativePath, "larger than " + maxFileBytes + " bytes");
                    return;
                }
                if (BinarySniffer.isBinary(file)) {
                    log.debug("Skipping binary file: {}", relativePath);
                    skipped.recordBinary(relativePath, "binary content");
                    return;
                }
                ready.add(new DiscoveredFile(file, relativePath, language.get(), size));
            } catch (AccessDeniedException e) {
                log.warn("Permission denied, skipping file: {}", relativePath);
                skipped.recordPermissionDenied(relativePath);
            } catch (IOException e) {
                log.warn("Cannot read {}: {}. Skipping.", relativePath, e.getMessage());
                skipped.recordPermissionDenied(relativePath);
            }
        }

        private String relative(Path path) {
            return FileUtils.toUnixRelativePath(root, path);
        }
    }
}
