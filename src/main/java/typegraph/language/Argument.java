package typegraph.language;

import typegraph.PublicApi;

@PublicApi
public class Argument implements Node {

    private final String name;
    private final Value value;
    private final SourceLocation sourceLocation;

    public Argument(String name, Value value) {
        this(name, value, null);
    }

    public Argument(String name, Value value, SourceLocation sourceLocation) {
        this.name = name;
        this.value = value;
        this.sourceLocation = sourceLocation;
    }

    public String getName() {
        return name;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "Argument{name='" + name + "', value=" + value + '}';
    }
}
