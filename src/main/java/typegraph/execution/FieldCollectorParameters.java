package typegraph.execution;

import typegraph.Internal;
import typegraph.language.FragmentDefinition;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static typegraph.Assert.assertNotNull;

/**
 * Internal because FieldCollector is internal.
 */
@Internal
public class FieldCollectorParameters {
    private final GraphQLSchema graphQLSchema;
    private final Map<String, FragmentDefinition> fragmentsByName;
    private final Map<String, Object> variables;
    private final GraphQLObjectType objectType;
    private final ValuesResolver valuesResolver;

    public GraphQLSchema getGraphQLSchema() {
        return graphQLSchema;
    }

    public Map<String, FragmentDefinition> getFragmentsByName() {
        return fragmentsByName;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public GraphQLObjectType getObjectType() {
        return objectType;
    }

    public ValuesResolver getValuesResolver() {
        return valuesResolver;
    }

    private FieldCollectorParameters(GraphQLSchema graphQLSchema, Map<String, Object> variables, Map<String, FragmentDefinition> fragmentsByName, GraphQLObjectType objectType, ValuesResolver valuesResolver) {
        this.fragmentsByName = fragmentsByName;
        this.graphQLSchema = graphQLSchema;
        this.variables = variables;
        this.objectType = objectType;
        this.valuesResolver = valuesResolver;
    }

    public static Builder newParameters() {
        return new Builder();
    }

    public static class Builder {
        private GraphQLSchema graphQLSchema;
        private final Map<String, FragmentDefinition> fragmentsByName = new LinkedHashMap<>();
        private final Map<String, Object> variables = new LinkedHashMap<>();
        private GraphQLObjectType objectType;
        private ValuesResolver valuesResolver;

        /**
         * @see FieldCollectorParameters#newParameters()
         */
        private Builder() {
        }

        public Builder schema(GraphQLSchema graphQLSchema) {
            this.graphQLSchema = graphQLSchema;
            return this;
        }

        public Builder objectType(GraphQLObjectType objectType) {
            this.objectType = objectType;
            return this;
        }

        public Builder fragments(Map<String, FragmentDefinition> fragmentsByName) {
            this.fragmentsByName.putAll(fragmentsByName);
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables.putAll(variables);
            return this;
        }

        public Builder valuesResolver(ValuesResolver valuesResolver) {
            this.valuesResolver = valuesResolver;
            return this;
        }

        public FieldCollectorParameters build() {
            assertNotNull(graphQLSchema, "You must provide a schema");
            assertNotNull(objectType, "You must provide an object type");
            ValuesResolver resolver = valuesResolver != null ? valuesResolver : new ValuesResolver(graphQLSchema, UnknownInputFieldPolicy.REJECT);
            return new FieldCollectorParameters(graphQLSchema, Collections.unmodifiableMap(variables), Collections.unmodifiableMap(fragmentsByName), objectType, resolver);
        }
    }
}
