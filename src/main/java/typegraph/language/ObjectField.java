package typegraph.language;

import typegraph.PublicApi;

@PublicApi
public class ObjectField {

    private final String name;
    private final Value value;

    public ObjectField(String name, Value value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "ObjectField{name='" + name + "', value=" + value + '}';
    }
}
