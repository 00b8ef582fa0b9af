package com.oclparser.view;

import com.oclparser.ast.ArrayValue;
import com.oclparser.ast.Attribute;
import com.oclparser.ast.Block;
import com.oclparser.ast.Dictionary;
import com.oclparser.ast.Document;
import com.oclparser.ast.Literal;
import com.oclparser.ast.Member;
import com.oclparser.ast.Node;
import com.oclparser.ast.Recovery;
import com.oclparser.ast.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Name resolution shared by the root, block and dictionary views.
 */
final class Lookups {

    private Lookups() {
        // Utility class
    }

    /**
     * Resolves {@code name} against a body. Attributes win over blocks: one attribute resolves to
     * its value, several to a list of their values in source order. Otherwise same-named blocks
     * resolve to a {@link BlockCollection}.
     */
    static Optional<ViewValue> member(Document document, List<Member> members, String name) {
        List<ViewValue> values = new ArrayList<>();
        List<Block> blocks = new ArrayList<>();
        for (Member member : members) {
            if (member instanceof Attribute attribute && attribute.name().equals(name)) {
                attributeValue(document, attribute).ifPresent(values::add);
            } else if (member instanceof Block block && block.name().equals(name)) {
                blocks.add(block);
            }
        }

        if (values.size() == 1) {
            return Optional.of(values.get(0));
        }
        if (values.size() > 1) {
            return Optional.of(new ValueList(values));
        }
        if (!blocks.isEmpty()) {
            return Optional.of(new BlockCollection(document, blocks));
        }
        return Optional.empty();
    }

    /**
     * Resolves every name in a body in one pass, in first-occurrence order. Names whose
     * attributes all failed to parse and that have no same-named blocks are left out.
     */
    static Map<String, ViewValue> members(Document document, List<Member> members) {
        Map<String, List<ViewValue>> values = new LinkedHashMap<>();
        Map<String, List<Block>> blocks = new HashMap<>();
        for (Member member : members) {
            if (member instanceof Attribute attribute) {
                List<ViewValue> named = values.computeIfAbsent(attribute.name(), name -> new ArrayList<>());
                attributeValue(document, attribute).ifPresent(named::add);
            } else if (member instanceof Block block) {
                values.computeIfAbsent(block.name(), name -> new ArrayList<>());
                blocks.computeIfAbsent(block.name(), name -> new ArrayList<>()).add(block);
            }
        }

        Map<String, ViewValue> resolved = new LinkedHashMap<>();
        values.forEach((name, named) -> {
            if (named.size() == 1) {
                resolved.put(name, named.get(0));
            } else if (named.size() > 1) {
                resolved.put(name, new ValueList(named));
            } else if (blocks.containsKey(name)) {
                resolved.put(name, new BlockCollection(document, blocks.get(name)));
            }
        });
        return resolved;
    }

    static Optional<ViewValue> attributeValue(Document document, Attribute attribute) {
        Value value = attribute.value();
        if (value instanceof Literal literal) {
            return Optional.of(Scalar.of(literal.value()));
        } else if (value instanceof Dictionary dictionary) {
            return Optional.of(new DictionaryView(document, dictionary));
        } else if (value instanceof ArrayValue array) {
            return Optional.of(arrayValue(document, array));
        } else if (value instanceof Recovery) {
            return Optional.empty();
        }
        throw new IllegalStateException("Unknown value type: " + value.type());
    }

    // Only literal and dictionary elements are kept
    static ValueList arrayValue(Document document, ArrayValue array) {
        List<ViewValue> items = new ArrayList<>();
        for (Value element : array.elements()) {
            if (element instanceof Literal literal) {
                items.add(Scalar.of(literal.value()));
            } else if (element instanceof Dictionary dictionary) {
                items.add(new DictionaryView(document, dictionary));
            }
        }
        return new ValueList(items);
    }

    static NodeView wrapMember(Document document, Member member) {
        if (member instanceof Block block) {
            return new BlockView(document, block);
        } else if (member instanceof Attribute attribute) {
            return new AttributeView(document, attribute);
        } else if (member instanceof Recovery recovery) {
            return new OpaqueView(document, recovery);
        }
        throw new IllegalStateException("Unknown member type: " + member.type());
    }

    static Optional<String> owningAttributeName(Document document, Dictionary dictionary) {
        Optional<Node> parent = document.parentOf(dictionary);
        while (parent.isPresent() && parent.get() instanceof ArrayValue array) {
            parent = document.parentOf(array);
        }
        return parent
            .filter(Attribute.class::isInstance)
            .map(node -> ((Attribute) node).name());
    }

    static List<String> indices(int size) {
        return IntStream.range(0, size)
            .mapToObj(Integer::toString)
            .toList();
    }

    static Map<String, Object> tree(Map<String, ViewValue> entries) {
        Map<String, Object> tree = new LinkedHashMap<>();
        entries.forEach((key, value) -> tree.put(key, value.toInterchangeTree()));
        return Collections.unmodifiableMap(tree);
    }
}
