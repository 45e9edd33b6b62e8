package typegraph.schema;

import typegraph.PublicApi;

@PublicApi
public class GraphQLTypeUtil {

    /**
     * Prints the type in the shorthand form, for example {@code [Character!]!}
     *
     * @param type the type to print
     *
     * @return the type in shorthand form
     */
    public static String simplePrint(GraphQLType type) {
        if (type instanceof GraphQLNonNull) {
            return simplePrint(((GraphQLNonNull) type).getWrappedType()) + "!";
        }
        if (type instanceof GraphQLList) {
            return "[" + simplePrint(((GraphQLList) type).getWrappedType()) + "]";
        }
        return type.getName();
    }

    public static boolean isNonNull(GraphQLType type) {
        return type instanceof GraphQLNonNull;
    }

    public static boolean isNullable(GraphQLType type) {
        return !isNonNull(type);
    }

    public static boolean isList(GraphQLType type) {
        return type instanceof GraphQLList;
    }

    public static boolean isReference(GraphQLType type) {
        return type instanceof GraphQLTypeReference;
    }

    public static GraphQLType unwrapNonNull(GraphQLType type) {
        if (type instanceof GraphQLNonNull) {
            return ((GraphQLNonNull) type).getWrappedType();
        }
        return type;
    }

    /**
     * Strips every list and non-null wrapper off a type
     *
     * @param type the type to unwrap
     *
     * @return the named type (or reference) at the bottom of the wrappers
     */
    public static GraphQLType unwrapAll(GraphQLType type) {
        GraphQLType current = type;
        while (current instanceof GraphQLModifiedType) {
            current = ((GraphQLModifiedType) current).getWrappedType();
        }
        return current;
    }
}
