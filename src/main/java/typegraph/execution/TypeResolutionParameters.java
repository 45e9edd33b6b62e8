package typegraph.execution;

import typegraph.Internal;
import typegraph.language.Field;
import typegraph.schema.GraphQLOutputType;
import typegraph.schema.GraphQLSchema;

import java.util.Map;

@Internal
public class TypeResolutionParameters {

    private final GraphQLOutputType abstractType;
    private final Field field;
    private final Object value;
    private final Map<String, Object> argumentValues;
    private final GraphQLSchema schema;
    private final Object context;

    private TypeResolutionParameters(GraphQLOutputType abstractType, Field field, Object value, Map<String, Object> argumentValues, GraphQLSchema schema, Object context) {
        this.abstractType = abstractType;
        this.field = field;
        this.value = value;
        this.argumentValues = argumentValues;
        this.schema = schema;
        this.context = context;
    }

    /**
     * @return the interface or union to resolve
     */
    public GraphQLOutputType getAbstractType() {
        return abstractType;
    }

    public Field getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }

    public Map<String, Object> getArgumentValues() {
        return argumentValues;
    }

    public GraphQLSchema getSchema() {
        return schema;
    }

    public Object getContext() {
        return context;
    }

    public static Builder newParameters() {
        return new Builder();
    }

    public static class Builder {

        private Field field;
        private GraphQLOutputType abstractType;
        private Object value;
        private Map<String, Object> argumentValues;
        private GraphQLSchema schema;
        private Object context;

        public Builder field(Field field) {
            this.field = field;
            return this;
        }

        public Builder abstractType(GraphQLOutputType abstractType) {
            this.abstractType = abstractType;
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder argumentValues(Map<String, Object> argumentValues) {
            this.argumentValues = argumentValues;
            return this;
        }

        public Builder schema(GraphQLSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder context(Object context) {
            this.context = context;
            return this;
        }

        public TypeResolutionParameters build() {
            return new TypeResolutionParameters(abstractType, field, value, argumentValues, schema, context);
        }
    }
}
