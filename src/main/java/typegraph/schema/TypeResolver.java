package typegraph.schema;

import typegraph.PublicSpi;
import typegraph.TypeResolutionEnvironment;

/**
 * An explicit resolver for an interface or union: given a value, it names the object type that backs it.
 * The returned type must be an implementation (or member) of the abstract type.
 */
@PublicSpi
@FunctionalInterface
public interface TypeResolver {

    /**
     * @param env the value and the abstract type it belongs to
     *
     * @return the object type backing the value, or null if it can't be told
     */
    GraphQLObjectType getType(TypeResolutionEnvironment env);
}
