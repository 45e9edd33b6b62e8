package typegraph.schema;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static typegraph.Assert.assertNotEmpty;
import static typegraph.Assert.assertValidName;

@PublicApi
public class GraphQLUnionType implements GraphQLOutputType {

    private final String name;
    private final String description;
    private final List<GraphQLOutputType> possibleTypes;
    private final TypeResolver typeResolver;

    private GraphQLUnionType(String name, String description, List<GraphQLOutputType> possibleTypes, TypeResolver typeResolver) {
        this.name = assertValidName(name);
        this.description = description;
        assertNotEmpty(possibleTypes, "A union type must define one or more member types");
        this.possibleTypes = Collections.unmodifiableList(new ArrayList<>(possibleTypes));
        this.typeResolver = typeResolver;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.UNION;
    }

    /**
     * @return the member types in declaration order, each either a {@link GraphQLObjectType} or a {@link GraphQLTypeReference}
     */
    public List<GraphQLOutputType> getTypes() {
        return possibleTypes;
    }

    public TypeResolver getTypeResolver() {
        return typeResolver;
    }

    @Override
    public String toString() {
        return "GraphQLUnionType{name='" + name + "', possibleTypes=" + possibleTypes + '}';
    }

    public static Builder newUnionType() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private final List<GraphQLOutputType> types = new ArrayList<>();
        private TypeResolver typeResolver;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder possibleType(GraphQLObjectType type) {
            types.add(type);
            return this;
        }

        public Builder possibleType(GraphQLTypeReference reference) {
            types.add(reference);
            return this;
        }

        public Builder typeResolver(TypeResolver typeResolver) {
            this.typeResolver = typeResolver;
            return this;
        }

        public GraphQLUnionType build() {
            return new GraphQLUnionType(name, description, types, typeResolver);
        }
    }
}
