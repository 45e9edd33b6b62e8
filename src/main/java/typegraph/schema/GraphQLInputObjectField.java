package typegraph.schema;

import typegraph.PublicApi;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertValidName;

@PublicApi
public class GraphQLInputObjectField {

    private final String name;
    private final String description;
    private final GraphQLInputType type;
    private final Object defaultValue;
    private final boolean hasDefaultValue;

    private GraphQLInputObjectField(String name, String description, GraphQLInputType type, Object defaultValue, boolean hasDefaultValue) {
        this.name = assertValidName(name);
        this.description = description;
        this.type = assertNotNull(type, "type can't be null");
        this.defaultValue = defaultValue;
        this.hasDefaultValue = hasDefaultValue;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public GraphQLInputType getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return hasDefaultValue;
    }

    public static Builder newInputObjectField() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private GraphQLInputType type;
        private Object defaultValue;
        private boolean hasDefaultValue;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(GraphQLInputType type) {
            this.type = type;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            this.hasDefaultValue = true;
            return this;
        }

        public GraphQLInputObjectField build() {
            return new GraphQLInputObjectField(name, description, type, defaultValue, hasDefaultValue);
        }
    }
}
