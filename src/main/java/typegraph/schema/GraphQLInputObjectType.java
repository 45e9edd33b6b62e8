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
public class GraphQLInputObjectType implements GraphQLInputType {

    private final String name;
    private final String description;
    private final Map<String, GraphQLInputObjectField> fieldMap;

    private GraphQLInputObjectType(String name, String description, Map<String, GraphQLInputObjectField> fieldMap) {
        this.name = assertValidName(name);
        this.description = description;
        this.fieldMap = Collections.unmodifiableMap(new LinkedHashMap<>(fieldMap));
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
        return TypeKind.INPUT_OBJECT;
    }

    public GraphQLInputObjectField getField(String name) {
        return fieldMap.get(name);
    }

    public List<GraphQLInputObjectField> getFields() {
        return new ArrayList<>(fieldMap.values());
    }

    @Override
    public String toString() {
        return "GraphQLInputObjectType{name='" + name + "'}";
    }

    public static Builder newInputObject() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private final Map<String, GraphQLInputObjectField> fields = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder field(GraphQLInputObjectField field) {
            assertTrue(!fields.containsKey(field.getName()), String.format("Input field '%s' is defined more than once", field.getName()));
            fields.put(field.getName(), field);
            return this;
        }

        public Builder field(GraphQLInputObjectField.Builder builder) {
            return field(builder.build());
        }

        public GraphQLInputObjectType build() {
            return new GraphQLInputObjectType(name, description, fields);
        }
    }
}
