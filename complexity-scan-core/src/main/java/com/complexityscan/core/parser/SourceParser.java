package com.complexityscan.core.parser;

import com.complexityscan.core.language.Grammar;

/**
 * Turns the bytes of one file into a syntax tree.
 *
 * <p>Implementations never throw for bad input: malformed source, bad encoding or an
 * unavailable grammar all come back as a failed {@link ParseOutcome}, so one file can
 * never abort a batch.
 */
public interface SourceParser {

    /**
     * Returns the language this parser handles.
     *
     * @return language id
     */
    String languageId();

    /**
     * Parses file content.
     *
     * @param content raw file bytes, possibly starting with a UTF-8 BOM
     * @return parsed tree or failure
     */
    ParseOutcome parse(byte[] content);

    /**
     * Creates the parser for a grammar handle.
     *
     * @param grammar grammar from the registry
     * @param failOnSyntaxErrors treat recovered syntax errors as failures
     * @return parser; for an unavailable grammar, one that fails every file
     */
    static SourceParser forGrammar(Grammar grammar, boolean failOnSyntaxErrors) {
        if (!grammar.isAvailable()) {
            String languageId = grammar.profile().id();
            String reason = grammar.unavailableReason();
            return new SourceParser() {
                @Override
                public String languageId() {
                    return languageId;
                }

                @Override
                public ParseOutcome parse(byte[] content) {
                    return ParseOutcome.failed(reason);
                }
            };
        }
        return new TreeSitterSourceParser(grammar, failOnSyntaxErrors);
    }
}
