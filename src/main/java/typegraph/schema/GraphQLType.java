package typegraph.schema;

import typegraph.PublicApi;

/**
 * A node of the type graph. Named types are identified by their name, while {@link GraphQLList} and
 * {@link GraphQLNonNull} are structural wrappers identified by the type they wrap and have no name.
 */
@PublicApi
public interface GraphQLType {

    /**
     * @return the name of the type, or null for list and non-null wrappers
     */
    String getName();

    TypeKind getKind();
}
