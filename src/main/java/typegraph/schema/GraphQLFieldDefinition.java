package typegraph.schema;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertTrue;
import static typegraph.Assert.assertValidName;

/**
 * An output field: its declared type, its arguments and the resolver that produces its raw value. Fields without
 * an explicit resolver read the property of the same name from the parent value.
 */
@PublicApi
public class GraphQLFieldDefinition {

    private final String name;
    private final String description;
    private final GraphQLOutputType type;
    private final Map<String, GraphQLArgument> arguments;
    private final DataFetcher<?> dataFetcher;
    private final String deprecationReason;

    private GraphQLFieldDefinition(String name, String description, GraphQLOutputType type, Map<String, GraphQLArgument> arguments, DataFetcher<?> dataFetcher, String deprecationReason) {
        this.name = assertValidName(name);
        this.description = description;
        this.type = assertNotNull(type, "type can't be null for field '" + name + "'");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.dataFetcher = dataFetcher != null ? dataFetcher : new PropertyDataFetcher<>(name);
        this.deprecationReason = deprecationReason;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public GraphQLOutputType getType() {
        return type;
    }

    public List<GraphQLArgument> getArguments() {
        return new ArrayList<>(arguments.values());
    }

    public GraphQLArgument getArgument(String name) {
        return arguments.get(name);
    }

    public DataFetcher<?> getDataFetcher() {
        return dataFetcher;
    }

    public String getDeprecationReason() {
        return deprecationReason;
    }

    public boolean isDeprecated() {
        return deprecationReason != null;
    }

    @Override
    public String toString() {
        return "GraphQLFieldDefinition{name='" + name + "', type=" + type + ", arguments=" + arguments.keySet() + '}';
    }

    public static Builder newFieldDefinition() {
        return new Builder();
    }

    @PublicApi
    public static class Builder {
        private String name;
        private String description;
        private GraphQLOutputType type;
        private final Map<String, GraphQLArgument> arguments = new LinkedHashMap<>();
        private DataFetcher<?> dataFetcher;
        private String deprecationReason;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(GraphQLOutputType type) {
            this.type = type;
            return this;
        }

        public Builder argument(GraphQLArgument argument) {
            assertTrue(!arguments.containsKey(argument.getName()), String.format("Argument '%s' is defined more than once", argument.getName()));
            arguments.put(argument.getName(), argument);
            return this;
        }

        public Builder argument(GraphQLArgument.Builder builder) {
            return argument(builder.build());
        }

        public Builder dataFetcher(DataFetcher<?> dataFetcher) {
            this.dataFetcher = dataFetcher;
            return this;
        }

        public Builder staticValue(Object value) {
            this.dataFetcher = new StaticDataFetcher(value);
            return this;
        }

        public Builder deprecate(String deprecationReason) {
            this.deprecationReason = deprecationReason;
            return this;
        }

        public GraphQLFieldDefinition build() {
            return new GraphQLFieldDefinition(name, description, type, arguments, dataFetcher, deprecationReason);
        }
    }
}
