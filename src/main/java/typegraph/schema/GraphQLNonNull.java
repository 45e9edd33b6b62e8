package typegraph.schema;

import typegraph.PublicApi;

import java.util.Objects;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertTrue;

/**
 * A non-null wrapper. It wraps exactly one type which may not itself be non-null.
 */
@PublicApi
public class GraphQLNonNull implements GraphQLOutputType, GraphQLInputType, GraphQLModifiedType {

    private final GraphQLType wrappedType;

    public GraphQLNonNull(GraphQLType wrappedType) {
        assertNotNull(wrappedType, "wrappedType can't be null");
        assertTrue(!(wrappedType instanceof GraphQLNonNull), "A non null type cannot wrap another non null type");
        this.wrappedType = wrappedType;
    }

    public static GraphQLNonNull nonNull(GraphQLType wrappedType) {
        return new GraphQLNonNull(wrappedType);
    }

    @Override
    public GraphQLType getWrappedType() {
        return wrappedType;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.NON_NULL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GraphQLNonNull && Objects.equals(wrappedType, ((GraphQLNonNull) o).wrappedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeKind.NON_NULL, wrappedType);
    }

    @Override
    public String toString() {
        return GraphQLTypeUtil.simplePrint(this);
    }
}
