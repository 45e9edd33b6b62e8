package typegraph.schema;

import typegraph.PublicApi;

/**
 * Types that can be the declared type of an argument or an input object field
 */
@PublicApi
public interface GraphQLInputType extends GraphQLType {
}
