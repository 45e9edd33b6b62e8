package typegraph.schema;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static typegraph.Assert.assertTrue;
import static typegraph.Assert.assertValidName;

/**
 * A concrete composite type. It may declare conformance to interfaces (given directly or by
 * {@link GraphQLTypeReference}) and may carry an {@code isTypeOf} predicate, used to recognise its values
 * when an interface or union has no explicit {@link TypeResolver}.
 */
@PublicApi
public class GraphQLObjectType implements GraphQLFieldsContainer {

    private final String name;
    private final String description;
    private final Map<String, GraphQLFieldDefinition> fieldDefinitionsByName;
    private final List<GraphQLOutputType> interfaces;
    private final Predicate<Object> isTypeOf;

    private GraphQLObjectType(String name, String description, Map<String, GraphQLFieldDefinition> fieldDefinitionsByName, List<GraphQLOutputType> interfaces, Predicate<Object> isTypeOf) {
        this.name = assertValidName(name);
        this.description = description;
        this.fieldDefinitionsByName = Collections.unmodifiableMap(new LinkedHashMap<>(fieldDefinitionsByName));
        this.interfaces = Collections.unmodifiableList(new ArrayList<>(interfaces));
        this.isTypeOf = isTypeOf;
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
        return TypeKind.OBJECT;
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
     * @return the declared interfaces, each either a {@link GraphQLInterfaceType} or a {@link GraphQLTypeReference}
     */
    public List<GraphQLOutputType> getInterfaces() {
        return interfaces;
    }

    public Predicate<Object> getIsTypeOf() {
        return isTypeOf;
    }

    public boolean isTypeOf(Object value) {
        return isTypeOf != null && isTypeOf.test(value);
    }

    @Override
    public String toString() {
        return "GraphQLObjectType{name='" + name + "', fields=" + fieldDefinitionsByName.keySet() + '}';
    }

    public static Builder newObject() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private final Map<String, GraphQLFieldDefinition> fields = new LinkedHashMap<>();
        private final List<GraphQLOutputType> interfaces = new ArrayList<>();
        private Predicate<Object> isTypeOf;

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

        public Builder withInterface(GraphQLInterfaceType interfaceType) {
            interfaces.add(interfaceType);
            return this;
        }

        public Builder withInterface(GraphQLTypeReference reference) {
            interfaces.add(reference);
            return this;
        }

        public Builder isTypeOf(Predicate<Object> isTypeOf) {
            this.isTypeOf = isTypeOf;
            return this;
        }

        public GraphQLObjectType build() {
            return new GraphQLObjectType(name, description, fields, interfaces, isTypeOf);
        }
    }
}
