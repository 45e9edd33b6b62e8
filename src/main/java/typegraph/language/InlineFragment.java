package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@PublicApi
public class InlineFragment implements Selection {

    private final String typeCondition;
    private final List<Directive> directives;
    private final SelectionSet selectionSet;
    private final SourceLocation sourceLocation;

    public InlineFragment(String typeCondition, SelectionSet selectionSet) {
        this(typeCondition, Collections.emptyList(), selectionSet, null);
    }

    public InlineFragment(String typeCondition, List<Directive> directives, SelectionSet selectionSet, SourceLocation sourceLocation) {
        this.typeCondition = typeCondition;
        this.directives = Collections.unmodifiableList(new ArrayList<>(directives));
        this.selectionSet = selectionSet;
        this.sourceLocation = sourceLocation;
    }

    /**
     * @return the name of the type this fragment applies to, or null if it applies to the enclosing type
     */
    public String getTypeCondition() {
        return typeCondition;
    }

    @Override
    public List<Directive> getDirectives() {
        return directives;
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
        return "InlineFragment{typeCondition='" + typeCondition + "', selectionSet=" + selectionSet + '}';
    }
}
