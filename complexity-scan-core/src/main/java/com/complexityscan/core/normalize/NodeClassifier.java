package com.complexityscan.core.normalize;

import com.complexityscan.core.language.LanguageProfile;
import com.complexityscan.core.model.NormalizedNodeKind;
import org.treesitter.TSNode;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies concrete syntax nodes of one language into {@link NormalizedNodeKind}s.
 *
 * <p>Named nodes are looked up in the profile's normalization table. Anonymous nodes
 * (operator tokens) are short-circuit operators when their token is one of the profile's
 * boolean operators and their parent is one of the listed expression kinds, so a
 * {@code &&} inside a string or a type never counts.
 *
 * <p>Instances are immutable and safe to share between worker threads.
 */
public final class NodeClassifier {

    private final LanguageProfile profile;
    private final Map<String, NormalizedNodeKind> kindIndex;
    private final Set<String> booleanOperators;
    private final Set<String> booleanParents;
    private final Set<String> classKinds;
    private final Set<String> containerKinds;

    public NodeClassifier(LanguageProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.kindIndex = profile.kindIndex();
        this.booleanOperators = Set.copyOf(profile.booleanOperators());
        this.booleanParents = Set.copyOf(profile.booleanParents());
        this.classKinds = profile.classKindSet();
        this.containerKinds = Set.copyOf(profile.containerKinds());
    }

    public LanguageProfile profile() {
        return profile;
    }

    /**
     * Classifies a node.
     *
     * @param node syntax node
     * @return its category, {@link NormalizedNodeKind#OTHER} when the table has no entry
     */
    public NormalizedNodeKind classify(TSNode node) {
        if (node == null || node.isNull()) {
            return NormalizedNodeKind.OTHER;
        }
        String type = node.getType();
        if (node.isNamed()) {
            return kindIndex.getOrDefault(type, NormalizedNodeKind.OTHER);
        }
        if (booleanOperators.contains(type)) {
            TSNode parent = node.getParent();
            if (parent != null && !parent.isNull() && booleanParents.contains(parent.getType())) {
                return NormalizedNodeKind.BOOLEAN_SHORT_CIRCUIT_OP;
            }
        }
        return NormalizedNodeKind.OTHER;
    }

    /**
     * Classifies a bare node kind string, ignoring operator tokens.
     *
     * @param nodeType concrete node kind
     * @return its category or {@link NormalizedNodeKind#OTHER}
     */
    public NormalizedNodeKind classify(String nodeType) {
        return kindIndex.getOrDefault(nodeType, NormalizedNodeKind.OTHER);
    }

    public boolean isFunction(TSNode node) {
        return node != null && !node.isNull() && node.isNamed()
            && kindIndex.get(node.getType()) == NormalizedNodeKind.FUNCTION;
    }

    public boolean isClassLike(TSNode node) {
        return node.isNamed() && classKinds.contains(node.getType());
    }

    public boolean isContainer(TSNode node) {
        return node.isNamed() && containerKinds.contains(node.getType());
    }
}
