package typegraph.schema;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static typegraph.Assert.assertTrue;
import static typegraph.Assert.assertValidName;

@PublicApi
public class GraphQLInterfaceType implements GraphQLFieldsContainer {

    private final String name;
    private final String description;
    private final Map<String, GraphQLFieldDefinition> fieldDefinitionsByName;
    private final TypeResolver typeResolver;

    private GraphQLInterfaceType(String name, String description, Map<String, GraphQLFieldDefinition> fieldDefinitionsByName, TypeResolver typeResolver) {
        this.name = assertValidName(name);
        this.description = description;
        this.fieldDefinitionsByName = Collections.unmodifiableMap(new LinkedHashMap<>(fieldDefinitionsByName));
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
        return TypeKind.INTERFACE;
    }

    @Override
    public GraphQLFieldDefinition getFieldDefinition(String name) {
        return fieldDefinitionsByName.get(name);
    }

    @Override
    public List<GraphQLFieldDefinition> getFieldDefinitions() {
        return new ArrayList<>(fieldDefinitionsByName.values());
    }

    /**
     * @return the explicit type resolver, or null when implementations are told apart by their isTypeOf predicates
     */
    public TypeResolver getTypeResolver() {
        return typeResolver;
    }

    @Override
    public String toString() {
        return "GraphQLInterfaceType{name='" + name + "', fields=" + fieldDefinitionsByName.keySet() + '}';
    }

    public static Builder newInterface() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private final Map<String, GraphQLFieldDefinition> fields = new LinkedHashMap<>();
        private TypeResolver typeResolver;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder field(GraphQLFieldDefinition fieldDefinition) {
            assertTrue(!fields.containsKey(fieldDefinition.getName()), String.format("Field '%s' is defined more than once", fieldDefinition.getName()));
            fields.put(fieldDefinition.getName(), fieldDefinition);
            return this;
        }

        public Builder field(GraphQLFieldDefinition.Builder builder) {
            return field(builder.build());
        }

        public Builder typeResolver(TypeResolver typeResolver) {
            this.typeResolver = typeResolver;
            return this;
        }

        public GraphQLInterfaceType build() {
            return new GraphQLInterfaceType(name, description, fields, typeResolver);
        }
    }
}
