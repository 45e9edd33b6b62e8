package typegraph.language;

import typegraph.PublicApi;

@PublicApi
public class FragmentDefinition implements Definition {

    private final String name;
    private final String typeCondition;
    private final SelectionSet selectionSet;
    private final SourceLocation sourceLocation;

    public FragmentDefinition(String name, String typeCondition, SelectionSet selectionSet) {
        this(name, typeCondition, selectionSet, null);
    }

    public FragmentDefinition(String name, String typeCondition, SelectionSet selectionSet, SourceLocation sourceLocation) {
        this.name = name;
        this.typeCondition = typeCondition;
        this.selectionSet = selectionSet;
        this.sourceLocation = sourceLocation;
    }

    public String getName() {
        return name;
    }

    public String getTypeCondition() {
        return typeCondition;
    }

    public SelectionSet getSelectionSet() {
        return selectionSet;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "FragmentDefinition{name='" + name + "', typeCondition='" + typeCondition + "', selectionSet=" + selectionSet + '}';
    }
}
