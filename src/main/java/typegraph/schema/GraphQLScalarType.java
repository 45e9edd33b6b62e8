package typegraph.schema;

import typegraph.PublicApi;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertValidName;

/**
 * A leaf type whose values are moved in and out of the engine by its {@link Coercing}
 */
@PublicApi
public class GraphQLScalarType implements GraphQLOutputType, GraphQLInputType {

    private final String name;
    private final String description;
    private final Coercing<?, ?> coercing;

    public GraphQLScalarType(String name, String description, Coercing<?, ?> coercing) {
        this.name = assertValidName(name);
        this.description = description;
        this.coercing = assertNotNull(coercing, "coercing can't be null");
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Coercing<?, ?> getCoercing() {
        return coercing;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.SCALAR;
    }

    @Override
    public String toString() {
        return "GraphQLScalarType{name='" + name + "'}";
    }
}
