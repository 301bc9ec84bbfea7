package com.complexityscan.core.language;

import com.complexityscan.core.util.FileUtils;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps file extensions to languages and languages to grammars.
 *
 * <p>Grammars are native libraries, so they are loaded lazily on first use and cached:
 * a scan of a Python-only tree never initializes the Rust grammar. Loading is
 * idempotent and thread-safe.
 *
 * <p>The registry is an ordinary object passed to whoever needs it, so two scans in the
 * same JVM never share loading state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LanguageRegistry registry = LanguageRegistry.fromClasspath();
 * registry.resolve(Path.of("app/main.py"))
 *     .map(profile -> registry.grammarFor(profile.id()))
 *     .filter(Grammar::isAvailable)
 *     .ifPresent(grammar -> ...);
 * }</pre>
 */
public final class LanguageRegistry {

    private static final Logger log = LoggerFactory.getLogger(LanguageRegistry.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Classpath resource holding the built-in language profiles.
     */
    public static final String DEFAULT_RESOURCE = "/languages.yaml";

    private final Map<String, LanguageProfile> profilesById;
    private final Map<String, LanguageProfile> profilesByExtension;
    private final Map<String, Grammar> grammarCache = new ConcurrentHashMap<>();

    public LanguageRegistry(Collection<LanguageProfile> profiles) {
        Map<String, LanguageProfile> byId = new TreeMap<>();
        Map<String, LanguageProfile> byExtension = new HashMap<>();
        for (LanguageProfile profile : profiles) {
            if (byId.put(profile.id(), profile) != null) {
                throw new IllegalArgumentException("Duplicate language id: " + profile.id());
            }
            for (String extension : profile.extensions()) {
                LanguageProfile previous = byExtension.put(extension, profile);
                if (previous != null) {
                    throw new IllegalArgumentException("Extension '" + extension + "' claimed by both "
                        + previous.id() + " and " + profile.id());
                }
            }
            // fail fast on a table that maps one node kind twice
            profile.kindIndex();
        }
        this.profilesById = Map.copyOf(byId);
        this.profilesByExtension = Map.copyOf(byExtension);
    }

    /**
     * Loads the built-in profiles from {@value #DEFAULT_RESOURCE}.
     *
     * @return registry with all bundled languages
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static LanguageRegistry fromClasspath() {
        try (InputStream in = LanguageRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Language catalog not found on classpath: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read language catalog " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads profiles from a YAML document with a top-level {@code languages} list.
     *
     * @param in YAML input, not closed
     * @return registry over the loaded profiles
     * @throws IOException if the document cannot be parsed
     */
    public static LanguageRegistry load(InputStream in) throws IOException {
        Catalog catalog = YAML_MAPPER.readValue(in, Catalog.class);
        log.debug("Loaded {} language profiles", catalog.languages().size());
        return new LanguageRegistry(catalog.languages());
    }

    /**
     * Resolves the language of a file from its extension (case-insensitive).
     *
     * @param path file path
     * @return matching profile, or empty for unrecognized extensions
     */
    public Optional<LanguageProfile> resolve(Path path) {
        String extension = FileUtils.getExtension(path);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(profilesByExtension.get(extension));
    }

    public Optional<LanguageProfile> profile(String languageId) {
        return Optional.ofNullable(profilesById.get(languageId));
    }

    /**
     * Returns all profiles sorted by id.
     *
     * @return profiles
     */
    public List<LanguageProfile> profiles() {
        List<LanguageProfile> result = new ArrayList<>(profilesById.values());
        result.sort(Comparator.comparing(LanguageProfile::id));
        return result;
    }

    /**
     * Returns the grammar of a language, loading it on first use.
     *
     * <p>A grammar that fails to load is cached as unavailable, so the failure is logged
     * once per scan rather than once per file.
     *
     * @param languageId language id
     * @return grammar handle, possibly unavailable
     * @throws IllegalArgumentException if the id is unknown
     */
    public Grammar grammarFor(String languageId) {
        LanguageProfile profile = profilesById.get(languageId);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown language: " + languageId);
        }
        return grammarCache.computeIfAbsent(languageId, id -> loadGrammar(profile));
    }

    private static Grammar loadGrammar(LanguageProfile profile) {
        try {
            Class<?> grammarClass = Class.forName(profile.grammarClass());
            TSLanguage language = (TSLanguage) grammarClass.getDeclaredConstructor().newInstance();
            log.info("{} grammar {} initialized", profile.displayName(), profile.grammarVersion());
            return Grammar.available(profile, language);
        } catch (ClassNotFoundException e) {
            log.warn("{} grammar not available: {}", profile.displayName(), e.getMessage());
            return Grammar.unavailable(profile, "grammar unavailable: " + profile.grammarClass() + " not on classpath");
        } catch (ReflectiveOperationException | ClassCastException | LinkageError e) {
            log.warn("{} grammar failed to initialize", profile.displayName(), e);
            return Grammar.unavailable(profile, "grammar unavailable: " + e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Catalog(@JsonProperty("languages") List<LanguageProfile> languages) {
        public Catalog {
            languages = languages == null ? List.of() : List.copyOf(languages);
        }
    }
}
