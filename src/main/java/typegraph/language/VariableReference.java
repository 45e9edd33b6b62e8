package typegraph.language;

import typegraph.PublicApi;

import java.util.Objects;

@PublicApi
public class VariableReference implements Value {

    private final String name;

    public VariableReference(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableReference && Objects.equals(name, ((VariableReference) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "VariableReference{name='" + name + "'}";
    }
}
