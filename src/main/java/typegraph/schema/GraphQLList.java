package typegraph.schema;

import typegraph.PublicApi;

import java.util.Objects;

import static typegraph.Assert.assertNotNull;

@PublicApi
public class GraphQLList implements GraphQLOutputType, GraphQLInputType, GraphQLModifiedType {

    private final GraphQLType wrappedType;

    public GraphQLList(GraphQLType wrappedType) {
        this.wrappedType = assertNotNull(wrappedType, "wrappedType can't be null");
    }

    public static GraphQLList list(GraphQLType wrappedType) {
        return new GraphQLList(wrappedType);
    }

    @Override
    public GraphQLType getWrappedType() {
        return wrappedType;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.LIST;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GraphQLList && Objects.equals(wrappedType, ((GraphQLList) o).wrappedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeKind.LIST, wrappedType);
    }

    @Override
    public String toString() {
        return GraphQLTypeUtil.simplePrint(this);
    }
}
