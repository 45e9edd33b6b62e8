package typegraph.schema;

import typegraph.PublicApi;

@PublicApi
public interface GraphQLModifiedType extends GraphQLType {

    GraphQLType getWrappedType();

    @Override
    default String getName() {
        return null;
    }
}
