package com.oclparser.view;

import com.oclparser.ast.Dictionary;
import com.oclparser.ast.Document;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * View over a {@code { ... }} attribute value. Its {@code __name} is the name of the attribute
 * that holds it, directly or as an array element.
 */
public final class DictionaryView extends NodeView {

    private final Dictionary dictionary;

    DictionaryView(Document document, Dictionary dictionary) {
        super(document, dictionary);
        this.dictionary = dictionary;
    }

    public Dictionary dictionary() {
        return dictionary;
    }

    @Override
    public Optional<String> name() {
        return Lookups.owningAttributeName(document, dictionary);
    }

    @Override
    public Optional<ViewValue> get(String name) {
        if (BlockView.NAME_KEY.equals(name)) {
            return name().map(Scalar::of);
        }
        return Lookups.member(document, dictionary.children(), name);
    }

    @Override
    Map<String, ViewValue> resolveEntries() {
        Map<String, ViewValue> entries = new LinkedHashMap<>(Lookups.members(document, dictionary.children()));
        name().ifPresent(name -> entries.put(BlockView.NAME_KEY, Scalar.of(name)));
        return entries;
    }
}
