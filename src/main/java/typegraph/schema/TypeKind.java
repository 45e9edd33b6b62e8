package typegraph.schema;

import typegraph.PublicApi;

/**
 * The closed set of kinds a {@link GraphQLType} can be. Value completion and input coercion dispatch on this.
 */
@PublicApi
public enum TypeKind {
    SCALAR,
    OBJECT,
    INTERFACE,
    UNION,
    ENUM,
    INPUT_OBJECT,
    LIST,
    NON_NULL;

    public boolean isLeaf() {
        return this == SCALAR || this == ENUM;
    }

    public boolean isAbstract() {
        return this == INTERFACE || this == UNION;
    }

    public boolean isWrapper() {
        return this == LIST || this == NON_NULL;
    }
}
