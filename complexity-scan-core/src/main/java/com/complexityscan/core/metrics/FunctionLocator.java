package com.complexityscan.core.metrics;

import com.complexityscan.core.language.LanguageProfile;
import com.complexityscan.core.language.LanguageProfile.ParameterRules;
import com.complexityscan.core.normalize.NodeClassifier;
import com.complexityscan.core.parser.ParseOutcome;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts the qualified name and parameter count of a function node.
 *
 * <p>Names are best effort: the function's own {@code name} field, else the variable,
 * property or assignment target it is bound to, else {@code <anonymous>}. Enclosing
 * containers (classes, impl blocks, Go receivers) are prepended with dots.
 */
public class FunctionLocator {

    static final String ANONYMOUS = "<anonymous>";

    private static final int MAX_BINDING_DEPTH = 3;
    private static final int MAX_NAME_LENGTH = 120;
    private static final Pattern NAME_PATTERN =
        Pattern.compile("[\\w$#@.:\\[\\]]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final NodeClassifier classifier;
    private final LanguageProfile profile;
    private final ParameterRules parameterRules;
    private final Set<String> ignoredParameterKinds;
    private final Set<String> groupedParameterKinds;

    public FunctionLocator(NodeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.profile = classifier.profile();
        this.parameterRules = profile.parameters();
        this.ignoredParameterKinds = Set.copyOf(parameterRules.ignoredKinds());
        this.groupedParameterKinds = Set.copyOf(parameterRules.groupedKinds());
    }

    /**
     * Builds the qualified name of a function.
     *
     * @param function function node
     * @param outcome parse outcome owning the node, for text access
     * @return qualified name, never blank
     */
    public String qualifiedName(TSNode function, ParseOutcome outcome) {
        String ownName = cleanName(outcome.textOf(field(function, "name")));
        if (ownName.isEmpty()) {
            ownName = bindingName(function, outcome);
        }
        if (ownName.isEmpty()) {
            ownName = ANONYMOUS;
        }

        Deque<String> qualifiers = new ArrayDeque<>();
        String receiver = receiverType(function, outcome);
        if (!receiver.isEmpty()) {
            qualifiers.push(receiver);
        }
        for (TSNode parent = function.getParent(); isPresent(parent); parent = parent.getParent()) {
            if (classifier.isContainer(parent)) {
                String containerName = containerName(parent, outcome);
                if (!containerName.isEmpty()) {
                    qualifiers.push(containerName);
                }
            }
        }

        List<String> parts = new ArrayList<>(qualifiers);
        parts.add(ownName);
        return String.join(".", parts);
    }

    /**
     * Counts the declared formal parameters of a function.
     *
     * @param function function node
     * @return parameter count, 0 when the function has no parameter list
     */
    public int parameterCount(TSNode function) {
        TSNode list = field(function, parameterRules.listField());
        if (!isPresent(list)) {
            return parameterRules.singleField() != null && isPresent(field(function, parameterRules.singleField()))
                ? 1 : 0;
        }
        if (list.getNamedChildCount() == 0) {
            // a bare identifier standing in for the list: x -> x + 1
            return list.getType().endsWith("identifier") ? 1 : 0;
        }

        int count = 0;
        for (int i = 0; i < list.getNamedChildCount(); i++) {
            TSNode child = list.getNamedChild(i);
            String type = child.getType();
            if (ignoredParameterKinds.contains(type)) {
                continue;
            }
            if (groupedParameterKinds.contains(type)) {
                count += Math.max(1, countNamedChildren(child, parameterRules.groupedNameKind()));
            } else {
                count++;
            }
        }
        return count;
    }

    private String bindingName(TSNode function, ParseOutcome outcome) {
        TSNode current = function;
        for (int depth = 0; depth < MAX_BINDING_DEPTH; depth++) {
            TSNode parent = current.getParent();
            if (!isPresent(parent) || classifier.isFunction(parent) || classifier.isContainer(parent)) {
                return "";
            }
            String fieldName = profile.bindingKinds().get(parent.getType());
            if (fieldName != null) {
                TSNode target = field(parent, fieldName);
                if (isPresent(target) && !sameNode(target, function)) {
                    return cleanName(outcome.textOf(target));
                }
                return "";
            }
            current = parent;
        }
        return "";
    }

    private String receiverType(TSNode function, ParseOutcome outcome) {
        if (profile.receiverField() == null) {
            return "";
        }
        TSNode receiver = field(function, profile.receiverField());
        if (!isPresent(receiver)) {
            return "";
        }
        TSNode typeNode = firstDescendantOfType(receiver, "type_identifier");
        return typeNode == null ? "" : cleanName(outcome.textOf(typeNode));
    }

    private String containerName(TSNode container, ParseOutcome outcome) {
        for (String fieldName : profile.containerNameFields()) {
            TSNode nameNode = field(container, fieldName);
            if (isPresent(nameNode)) {
                String text = outcome.textOf(nameNode);
                int generic = text.indexOf('<');
                if (generic > 0) {
                    text = text.substring(0, generic);
                }
                String cleaned = cleanName(text);
                if (!cleaned.isEmpty()) {
                    return cleaned;
                }
            }
        }
        return "";
    }

    static String cleanName(String text) {
        String name = text.strip();
        if (name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && last == first) {
                name = name.substring(1, name.length() - 1);
            }
        }
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH || !NAME_PATTERN.matcher(name).matches()) {
            return "";
        }
        return name;
    }

    private static TSNode field(TSNode node, String fieldName) {
        if (fieldName == null) {
            return null;
        }
        TSNode child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    private static int countNamedChildren(TSNode node, String type) {
        int count = 0;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            if (type.equals(node.getNamedChild(i).getType())) {
                count++;
            }
        }
        return count;
    }

    private static TSNode firstDescendantOfType(TSNode root, String type) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (type.equals(node.getType())) {
                return node;
            }
            List<TSNode> children = new ArrayList<>();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                children.add(node.getNamedChild(i));
            }
            Collections.reverse(children);
            children.forEach(stack::push);
        }
        return null;
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte()
            && a.getType().equals(b.getType());
    }

    private static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }
}
