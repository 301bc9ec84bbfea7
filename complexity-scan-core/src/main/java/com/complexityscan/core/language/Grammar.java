package com.complexityscan.core.language;

import org.treesitter.TSLanguage;

import java.util.Objects;

/**
 * Handle to a loaded (or unloadable) grammar.
 *
 * <p>A grammar that failed to load is still a valid handle: every file of that language
 * becomes a per-file parse failure instead of aborting the scan.
 *
 * @param profile language this grammar belongs to
 * @param language tree-sitter language, {@code null} when unavailable
 * @param unavailableReason why loading failed, {@code null} when available
 */
public record Grammar(
    LanguageProfile profile,
    TSLanguage language,
    String unavailableReason
) {
    public Grammar {
        Objects.requireNonNull(profile, "profile must not be null");
        if (language == null && unavailableReason == null) {
            unavailableReason = "grammar unavailable";
        }
    }

    public static Grammar available(LanguageProfile profile, TSLanguage language) {
        return new Grammar(profile, Objects.requireNonNull(language, "language must not be null"), null);
    }

    public static Grammar unavailable(LanguageProfile profile, String reason) {
        return new Grammar(profile, null, reason);
    }

    public boolean isAvailable() {
        return language != null;
    }
}
