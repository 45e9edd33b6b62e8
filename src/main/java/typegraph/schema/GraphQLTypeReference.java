package typegraph.schema;

import typegraph.PublicApi;

import java.util.Objects;

import static typegraph.Assert.assertShouldNeverHappen;
import static typegraph.Assert.assertValidName;

/**
 * A by-name reference to a named type. This is how self-referential and mutually recursive types are expressed:
 * the reference is looked up in the schema registry whenever the type behind it is needed.
 */
@PublicApi
public class GraphQLTypeReference implements GraphQLOutputType, GraphQLInputType {

    private final String name;

    public GraphQLTypeReference(String name) {
        this.name = assertValidName(name);
    }

    public static GraphQLTypeReference typeRef(String name) {
        return new GraphQLTypeReference(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public TypeKind getKind() {
        return assertShouldNeverHappen("type reference '" + name + "' must be resolved through the schema before use");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GraphQLTypeReference && Objects.equals(name, ((GraphQLTypeReference) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "GraphQLTypeReference{name='" + name + "'}";
    }
}
