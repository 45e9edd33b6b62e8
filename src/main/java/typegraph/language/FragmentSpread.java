package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@PublicApi
public class FragmentSpread implements Selection {

    private final String name;
    private final List<Directive> directives;
    private final SourceLocation sourceLocation;

    public FragmentSpread(String name) {
        this(name, Collections.emptyList(), null);
    }

    public FragmentSpread(String name, List<Directive> directives, SourceLocation sourceLocation) {
        this.name = name;
        this.directives = Collections.unmodifiableList(new ArrayList<>(directives));
        this.sourceLocation = sourceLocation;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<Directive> getDirectives() {
        return directives;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "FragmentSpread{name='" + name + "'}";
    }
}
