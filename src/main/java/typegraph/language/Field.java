package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static typegraph.Assert.assertNotNull;

/**
 * A field selection: the field name, an optional alias that becomes its response key, its argument literals
 * and an optional nested selection set.
 */
@PublicApi
public class Field implements Selection {

    private final String name;
    private final String alias;
    private final List<Argument> arguments;
    private final List<Directive> directives;
    private final SelectionSet selectionSet;
    private final SourceLocation sourceLocation;

    private Field(String name, String alias, List<Argument> arguments, List<Directive> directives, SelectionSet selectionSet, SourceLocation sourceLocation) {
        this.name = assertNotNull(name, "field name can't be null");
        this.alias = alias;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.directives = Collections.unmodifiableList(new ArrayList<>(directives));
        this.selectionSet = selectionSet;
        this.sourceLocation = sourceLocation;
    }

    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * @return the key under which this field appears in the result, the alias if there is one
     */
    public String getResultKey() {
        return alias != null ? alias : name;
    }

    public List<Argument> getArguments() {
        return arguments;
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
        return "Field{" +
                "name='" + name + '\'' +
                ", alias='" + alias + '\'' +
                ", arguments=" + arguments +
                ", directives=" + directives +
                ", selectionSet=" + selectionSet +
                '}';
    }

    public static Builder newField(String name) {
        return new Builder().name(name);
    }

    public static class Builder {
        private String name;
        private String alias;
        private final List<Argument> arguments = new ArrayList<>();
        private final List<Directive> directives = new ArrayList<>();
        private SelectionSet selectionSet;
        private SourceLocation sourceLocation;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder argument(String name, Value value) {
            this.arguments.add(new Argument(name, value));
            return this;
        }

        public Builder arguments(List<Argument> arguments) {
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder directive(Directive directive) {
            this.directives.add(directive);
            return this;
        }

        public Builder selectionSet(SelectionSet selectionSet) {
            this.selectionSet = selectionSet;
            return this;
        }

        public Builder selections(Selection... selections) {
            this.selectionSet = new SelectionSet(Arrays.asList(selections));
            return this;
        }

        public Builder sourceLocation(SourceLocation sourceLocation) {
            this.sourceLocation = sourceLocation;
            return this;
        }

        public Field build() {
            return new Field(name, alias, arguments, directives, selectionSet, sourceLocation);
        }
    }
}
