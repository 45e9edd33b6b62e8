package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed and validated query document: its operations and the fragments they spread.
 */
@PublicApi
public class Document implements Node {

    private final List<Definition> definitions;

    public Document(List<? extends Definition> definitions) {
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
    }

    public static Document of(Definition... definitions) {
        return new Document(Arrays.asList(definitions));
    }

    public List<Definition> getDefinitions() {
        return definitions;
    }

    public List<OperationDefinition> getOperations() {
        List<OperationDefinition> operations = new ArrayList<>();
        for (Definition definition : definitions) {
            if (definition instanceof OperationDefinition) {
                operations.add((OperationDefinition) definition);
            }
        }
        return operations;
    }

    public Map<String, FragmentDefinition> getFragmentsByName() {
        Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
        for (Definition definition : definitions) {
            if (definition instanceof FragmentDefinition) {
                FragmentDefinition fragment = (FragmentDefinition) definition;
                fragments.put(fragment.getName(), fragment);
            }
        }
        return fragments;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return null;
    }

    @Override
    public String toString() {
        return "Document{definitions=" + definitions + '}';
    }
}
