package com.complexityscan.core.language;

import com.complexityscan.core.model.NormalizedNodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the analyzer knows about one language.
 *
 * <p>Profiles are declarative and loaded from {@code languages.yaml}; no Java code is
 * specific to a language. Besides the normalization table a profile describes where
 * function names, parameters and enclosing containers live in the grammar.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * - id: python
 *   grammarClass: org.treesitter.TreeSitterPython
 *   grammarVersion: "0.23.4"
 *   extensions: [py, pyi]
 *   nodeKinds:
 *     FUNCTION: [function_definition]
 *     IF: [if_statement, elif_clause]
 *   booleanOperators: [and, or]
 *   booleanParents: [boolean_operator]
 * }</pre>
 *
 * @param id language id used in reports ({@code python}, {@code go}, ...)
 * @param displayName human-readable name
 * @param grammarClass fully qualified tree-sitter grammar class
 * @param grammarVersion pinned grammar artifact version, reported for reproducibility
 * @param extensions recognized file extensions without the leading dot
 * @param nodeKinds normalization table, category to concrete node kinds
 * @param booleanOperators operator tokens counted as short-circuit decisions
 * @param booleanParents node kinds whose operator child may be a short-circuit operator
 * @param classKinds node kinds counted as class-like declarations
 * @param containerKinds node kinds whose name qualifies nested function names
 * @param containerNameFields fields tried, in order, to name a container
 * @param receiverField field of a function holding a method receiver, if any
 * @param bindingKinds node kind to field naming an anonymous function bound to it
 * @param parameters where parameter lists live and how to count them
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LanguageProfile(
    @JsonProperty("id") String id,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("grammarClass") String grammarClass,
    @JsonProperty("grammarVersion") String grammarVersion,
    @JsonProperty("extensions") List<String> extensions,
    @JsonProperty("nodeKinds") Map<NormalizedNodeKind, List<String>> nodeKinds,
    @JsonProperty("booleanOperators") List<String> booleanOperators,
    @JsonProperty("booleanParents") List<String> booleanParents,
    @JsonProperty("classKinds") List<String> classKinds,
    @JsonProperty("containerKinds") List<String> containerKinds,
    @JsonProperty("containerNameFields") List<String> containerNameFields,
    @JsonProperty("receiverField") String receiverField,
    @JsonProperty("bindingKinds") Map<String, String> bindingKinds,
    @JsonProperty("parameters") ParameterRules parameters
) {
    public LanguageProfile {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(grammarClass, "grammarClass must not be null for " + id);
        if (displayName == null) {
            displayName = id;
        }
        if (grammarVersion == null) {
            grammarVersion = "unknown";
        }
        extensions = extensions == null ? List.of()
            : extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
        nodeKinds = nodeKinds == null || nodeKinds.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(nodeKinds));
        if (nodeKinds.containsKey(NormalizedNodeKind.OTHER)
            || nodeKinds.containsKey(NormalizedNodeKind.BOOLEAN_SHORT_CIRCUIT_OP)) {
            throw new IllegalArgumentException(
                "nodeKinds of " + id + " may not list OTHER or BOOLEAN_SHORT_CIRCUIT_OP; use booleanOperators");
        }
        booleanOperators = booleanOperators == null ? List.of() : List.copyOf(booleanOperators);
        booleanParents = booleanParents == null ? List.of() : List.copyOf(booleanParents);
        classKinds = classKinds == null ? List.of() : List.copyOf(classKinds);
        containerKinds = containerKinds == null ? List.of() : List.copyOf(containerKinds);
        containerNameFields = containerNameFields == null || containerNameFields.isEmpty()
            ? List.of("name") : List.copyOf(containerNameFields);
        bindingKinds = bindingKinds == null ? Map.of() : Map.copyOf(bindingKinds);
        if (parameters == null) {
            parameters = ParameterRules.defaults();
        }
    }

    /**
     * Builds the reverse lookup (concrete node kind to category) used by the classifier.
     *
     * @return concrete kind to normalized kind
     * @throws IllegalArgumentException if one concrete kind is listed under two categories
     */
    public Map<String, NormalizedNodeKind> kindIndex() {
        Map<String, NormalizedNodeKind> index = new HashMap<>();
        nodeKinds.forEach((category, kinds) -> {
            for (String kind : kinds) {
                NormalizedNodeKind previous = index.put(kind, category);
                if (previous != null && previous != category) {
                    throw new IllegalArgumentException(
                        "Node kind '" + kind + "' of " + id + " mapped to both " + previous + " and " + category);
                }
            }
        });
        return Map.copyOf(index);
    }

    public Set<String> classKindSet() {
        return Set.copyOf(classKinds);
    }

    /**
     * Describes how to find and count formal parameters.
     *
     * @param listField field of a function holding its parameter list
     * @param singleField field holding a lone unparenthesized parameter (JS arrow functions)
     * @param ignoredKinds named children of a parameter list that are not parameters
     * @param groupedKinds parameter declarations that may declare several names ({@code a, b int})
     * @param groupedNameKind node kind of each name inside a grouped declaration
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParameterRules(
        @JsonProperty("listField") String listField,
        @JsonProperty("singleField") String singleField,
        @JsonProperty("ignoredKinds") List<String> ignoredKinds,
        @JsonProperty("groupedKinds") List<String> groupedKinds,
        @JsonProperty("groupedNameKind") String groupedNameKind
    ) {
        public ParameterRules {
            if (listField == null) {
                listField = "parameters";
            }
            ignoredKinds = ignoredKinds == null ? List.of("comment") : List.copyOf(ignoredKinds);
            groupedKinds = groupedKinds == null ? List.of() : List.copyOf(groupedKinds);
            if (groupedNameKind == null) {
                groupedNameKind = "identifier";
            }
        }

        public static ParameterRules defaults() {
            return new ParameterRules("parameters", null, List.of("comment"), List.of(), "identifier");
        }
    }
}
