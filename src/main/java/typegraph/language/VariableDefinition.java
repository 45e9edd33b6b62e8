package typegraph.language;

import typegraph.PublicApi;

/**
 * A variable declared by an operation, with the literal used when the caller supplies no value for it
 */
@PublicApi
public class VariableDefinition implements Node {

    private final String name;
    private final Value defaultValue;
    private final SourceLocation sourceLocation;

    public VariableDefinition(String name) {
        this(name, null, null);
    }

    public VariableDefinition(String name, Value defaultValue) {
        this(name, defaultValue, null);
    }

    public VariableDefinition(String name, Value defaultValue, SourceLocation sourceLocation) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.sourceLocation = sourceLocation;
    }

    public String getName() {
        return name;
    }

    public Value getDefaultValue() {
        return defaultValue;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "VariableDefinition{name='" + name + "', defaultValue=" + defaultValue + '}';
    }
}
