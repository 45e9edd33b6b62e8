package typegraph.schema;

import typegraph.PublicApi;

/**
 * Types that can be the declared type of a field
 */
@PublicApi
public interface GraphQLOutputType extends GraphQLType {
}
