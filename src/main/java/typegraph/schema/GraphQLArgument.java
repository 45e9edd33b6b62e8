package typegraph.schema;

import typegraph.PublicApi;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertValidName;

/**
 * A field argument. The default value, when present, is an internal value used as-is when the query omits the
 * argument.
 */
@PublicApi
public class GraphQLArgument {

    private final String name;
    private final String description;
    private final GraphQLInputType type;
    private final Object defaultValue;
    private final boolean hasDefaultValue;

    private GraphQLArgument(String name, String description, GraphQLInputType type, Object defaultValue, boolean hasDefaultValue) {
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

    @Override
    public String toString() {
        return "GraphQLArgument{name='" + name + "', type=" + type + '}';
    }

    public static Builder newArgument() {
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

        public GraphQLArgument build() {
            return new GraphQLArgument(name, description, type, defaultValue, hasDefaultValue);
        }
    }
}
