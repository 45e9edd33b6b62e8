package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The ordered selections requested against one type
 */
@PublicApi
public class SelectionSet implements Node {

    private final List<Selection> selections;
    private final SourceLocation sourceLocation;

    public SelectionSet(List<? extends Selection> selections) {
        this(selections, null);
    }

    public SelectionSet(List<? extends Selection> selections, SourceLocation sourceLocation) {
        this.selections = Collections.unmodifiableList(new ArrayList<>(selections));
        this.sourceLocation = sourceLocation;
    }

    public static SelectionSet newSelectionSet(Selection... selections) {
        return new SelectionSet(Arrays.asList(selections));
    }

    public List<Selection> getSelections() {
        return selections;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "SelectionSet{selections=" + selections + '}';
    }
}
