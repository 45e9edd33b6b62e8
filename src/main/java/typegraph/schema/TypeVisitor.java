package typegraph.schema;

import typegraph.PublicApi;

/**
 * Called by the {@link SchemaTraverser} once for every distinct type it reaches
 */
@PublicApi
@FunctionalInterface
public interface TypeVisitor {

    void visit(GraphQLType type);
}
