package typegraph.language;

import typegraph.PublicApi;

import java.util.Objects;

@PublicApi
public class EnumValue implements Value {

    private final String name;

    public EnumValue(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnumValue && Objects.equals(name, ((EnumValue) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "EnumValue{name='" + name + "'}";
    }
}
