package com.complexityscan.core.parser;

import com.complexityscan.core.language.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.charset.CharacterCodingException;
import java.util.Objects;

/**
 * {@link SourceParser} backed by a tree-sitter grammar.
 *
 * <p>{@link TSParser} is not thread-safe, so a fresh parser is created for every file.
 * The grammar ({@code TSLanguage}) itself is immutable and shared.
 */
public class TreeSitterSourceParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterSourceParser.class);

    private final Grammar grammar;
    private final boolean failOnSyntaxErrors;

    public TreeSitterSourceParser(Grammar grammar, boolean failOnSyntaxErrors) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        if (!grammar.isAvailable()) {
            throw new IllegalArgumentException("Grammar not available: " + grammar.unavailableReason());
        }
        this.failOnSyntaxErrors = failOnSyntaxErrors;
    }

    @Override
    public String languageId() {
        return grammar.profile().id();
    }

    @Override
    public ParseOutcome parse(byte[] content) {
        byte[] source = SourceDecoder.stripBom(content);
        String text;
        try {
            text = SourceDecoder.decodeStrict(source);
        } catch (CharacterCodingException e) {
            return ParseOutcome.failed("invalid UTF-8: " + e.getMessage());
        }

        TSTree tree;
        try {
            TSParser parser = new TSParser();
            if (!parser.setLanguage(grammar.language())) {
                return ParseOutcome.failed("grammar unavailable: incompatible " + languageId() + " grammar version");
            }
            tree = parser.parseString(null, text);
        } catch (RuntimeException e) {
            log.debug("tree-sitter rejected {} input", languageId(), e);
            return ParseOutcome.failed("parser error: " + e.getMessage());
        }

        if (tree == null) {
            return ParseOutcome.failed("parser produced no tree");
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            return ParseOutcome.failed("parser produced no root node");
        }
        if ("ERROR".equals(root.getType())) {
            return ParseOutcome.failed("syntax errors: file could not be parsed as " + languageId());
        }
        boolean hasErrors = root.hasError();
        if (hasErrors && failOnSyntaxErrors) {
            return ParseOutcome.failed("syntax errors");
        }
        return ParseOutcome.parsed(tree, source, SourceDecoder.countLines(text), hasErrors);
    }
}
