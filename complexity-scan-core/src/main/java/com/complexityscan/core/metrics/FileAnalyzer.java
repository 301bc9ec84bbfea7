package com.complexityscan.core.metrics;

import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.model.FunctionRecord;
import com.complexityscan.core.model.ParseStatus;
import com.complexityscan.core.model.SourceFile;
import com.complexityscan.core.normalize.NodeClassifier;
import com.complexityscan.core.parser.ParseOutcome;
import com.complexityscan.core.parser.SourceParser;
import com.complexityscan.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Unit of work for one file: parse, normalize and score every function.
 *
 * <p>One analyzer serves one language and holds no per-file state, so a single instance
 * can be used from all worker threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NodeClassifier classifier = new NodeClassifier(profile);
 * FileAnalyzer analyzer = new FileAnalyzer(classifier, SourceParser.forGrammar(grammar, false));
 * FileMetrics metrics = analyzer.analyze("src/app.py", Files.readAllBytes(path));
 * }</pre>
 */
public class FileAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FileAnalyzer.class);

    private final NodeClassifier classifier;
    private final SourceParser parser;
    private final ComplexityCalculator calculator;
    private final FunctionLocator locator;

    public FileAnalyzer(NodeClassifier classifier, SourceParser parser) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.calculator = new ComplexityCalculator(classifier);
        this.locator = new FunctionLocator(classifier);
    }

    public String languageId() {
        return classifier.profile().id();
    }

    /**
     * Analyzes file content.
     *
     * @param relativePath root-relative path with forward slashes
     * @param content raw file bytes
     * @return metrics; a parse failure yields a failed status and no functions
     */
    public FileMetrics analyze(String relativePath, byte[] content) {
        SourceFile source = new SourceFile(relativePath, languageId(), content.length,
            FileUtils.sha256Hex(content), ParseStatus.success());

        ParseOutcome outcome = parser.parse(content);
        if (!outcome.isSuccess()) {
            log.debug("Parse failed for {}: {}", relativePath, outcome.failureReason());
            return FileMetrics.failed(source.withStatus(ParseStatus.failure(outcome.failureReason())));
        }
        if (outcome.hasSyntaxErrors()) {
            log.debug("{} parsed with recovered syntax errors", relativePath);
        }

        List<FunctionRecord> functions = new ArrayList<>();
        int classCount = 0;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(outcome.root());
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (classifier.isFunction(node)) {
                functions.add(toRecord(relativePath, node, outcome));
            } else if (classifier.isClassLike(node)) {
                classCount++;
            }
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (child != null && !child.isNull()) {
                    stack.push(child);
                }
            }
        }

        log.debug("{}: {} functions, {} classes", relativePath, functions.size(), classCount);
        return new FileMetrics(source, outcome.lineCount(), classCount, functions);
    }

    private FunctionRecord toRecord(String relativePath, TSNode function, ParseOutcome outcome) {
        ComplexityScore score = calculator.measure(function);
        int startLine = function.getStartPoint().getRow() + 1;
        int endLine = function.getEndPoint().getRow() + 1;
        return new FunctionRecord(
            relativePath,
            locator.qualifiedName(function, outcome),
            startLine,
            endLine,
            locator.parameterCount(function),
            score.cyclomatic(),
            score.cognitive(),
            score.maxNestingDepth(),
            endLine - startLine + 1
        );
    }
}
