package typegraph.execution;

import typegraph.GraphQLException;
import typegraph.PublicApi;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLType;

/**
 * This is thrown if a {@link typegraph.schema.TypeResolver} fails to give back a concrete type that belongs to the
 * interface or union, or when no candidate object type recognises the value
 */
@PublicApi
public class UnresolvedTypeException extends GraphQLException {

    private final GraphQLType abstractType;

    public UnresolvedTypeException(String message, GraphQLType abstractType) {
        super(message);
        this.abstractType = abstractType;
    }

    public UnresolvedTypeException(GraphQLType abstractType, Throwable cause) {
        super(String.format("Resolving the type of '%s' failed: %s", abstractType.getName(), cause.getMessage()), cause);
        this.abstractType = abstractType;
    }

    public UnresolvedTypeException(GraphQLType abstractType) {
        this("Could not determine the exact type of '" + abstractType.getName() + "'", abstractType);
    }

    public UnresolvedTypeException(GraphQLType abstractType, GraphQLObjectType resolvedType) {
        this(String.format("Runtime Object type '%s' is not a possible type for '%s'.", resolvedType.getName(), abstractType.getName()), abstractType);
    }

    public GraphQLType getAbstractType() {
        return abstractType;
    }
}
