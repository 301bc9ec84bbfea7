package com.complexityscan.core.discovery;

import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.ignore.IgnoreNode.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Gitignore-style path filter built on JGit's {@link IgnoreNode}.
 *
 * <p>Rule sets are checked from lowest to highest precedence (built-in defaults, the
 * root {@code .gitignore}, then caller patterns). The last set with an explicit match
 * decides, so a caller can re-include with {@code !pattern}.
 *
 * <p>Paths are root-relative with forward slashes, as {@link IgnoreNode#isIgnored}
 * expects. Directories are pruned by the walker, so a file below an ignored directory
 * is never checked.
 */
public final class IgnoreRules {

    private static final Logger log = LoggerFactory.getLogger(IgnoreRules.class);

    /**
     * Ignore set applied unless disabled.
     */
    public static final List<String> DEFAULT_PATTERNS = List.of(
        "node_modules/",
        "__pycache__/",
        "*.pyc",
        ".DS_Store",
        "*.min.js",
        "*.bundle.js",
        "dist/",
        "build/",
        "vendor/",
        ".venv/",
        "venv/",
        "*.egg-info/"
    );

    private static final IgnoreRules NONE = new IgnoreRules(List.of());

    private final List<IgnoreNode> nodes;

    private IgnoreRules(List<IgnoreNode> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public static IgnoreRules none() {
        return NONE;
    }

    /**
     * Builds the rules for a scan root.
     *
     * @param root scan root
     * @param useDefaults include {@link #DEFAULT_PATTERNS}
     * @param respectGitignore include the root {@code .gitignore} when present
     * @param extraPatterns caller patterns, highest precedence
     * @return combined rules
     */
    public static IgnoreRules forRoot(Path root, boolean useDefaults, boolean respectGitignore,
                                      Collection<String> extraPatterns) {
        List<IgnoreNode> nodes = new ArrayList<>();
        if (useDefaults) {
            nodes.add(fromPatterns(DEFAULT_PATTERNS));
        }
        if (respectGitignore) {
            Path gitignore = root.resolve(".gitignore");
            if (Files.isRegularFile(gitignore)) {
                try (InputStream in = Files.newInputStream(gitignore)) {
                    IgnoreNode node = new IgnoreNode();
                    node.parse(in);
                    nodes.add(node);
                    log.debug("Applied {} rules from {}", node.getRules().size(), gitignore);
                } catch (IOException e) {
                    log.warn("Could not read {}: {}. Continuing without it.", gitignore, e.getMessage());
                }
            }
        }
        if (extraPatterns != null && !extraPatterns.isEmpty()) {
            nodes.add(fromPatterns(extraPatterns));
        }
        return new IgnoreRules(nodes);
    }

    /**
     * Rules from a list of pattern lines.
     *
     * @param patterns gitignore lines
     * @return rules with a single precedence level
     */
    public static IgnoreRules of(Collection<String> patterns) {
        return new IgnoreRules(List.of(fromPatterns(patterns)));
    }

    /**
     * Checks one path.
     *
     * @param relativePath root-relative path with forward slashes
     * @param isDirectory whether the path is a directory
     * @return true if the path is excluded
     */
    public boolean isIgnored(String relativePath, boolean isDirectory) {
        MatchResult result = MatchResult.CHECK_PARENT;
        for (IgnoreNode node : nodes) {
            MatchResult nodeResult = node.isIgnored(relativePath, isDirectory);
            if (nodeResult == MatchResult.IGNORED || nodeResult == MatchResult.NOT_IGNORED) {
                result = nodeResult;
            }
        }
        return result == MatchResult.IGNORED;
    }

    private static IgnoreNode fromPatterns(Collection<String> patterns) {
        IgnoreNode node = new IgnoreNode();
        String text = String.join("\n", patterns) + "\n";
        try {
            node.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            // in-memory stream
            throw new UncheckedIOException(e);
        }
        return node;
    }
}
