package typegraph;

import typegraph.language.Field;
import typegraph.schema.GraphQLSchema;
import typegraph.schema.GraphQLType;

import java.util.Map;

/**
 * This is passed to a {@link typegraph.schema.TypeResolver} to help with object type resolution.
 */
@PublicApi
public class TypeResolutionEnvironment {

    private final Object object;
    private final Map<String, Object> arguments;
    private final Field field;
    private final GraphQLType fieldType;
    private final GraphQLSchema schema;
    private final Object context;

    public TypeResolutionEnvironment(Object object, Map<String, Object> arguments, Field field, GraphQLType fieldType, GraphQLSchema schema, Object context) {
        this.object = object;
        this.arguments = arguments;
        this.field = field;
        this.fieldType = fieldType;
        this.schema = schema;
        this.context = context;
    }

    /**
     * @param <T> you decide what type it is
     *
     * @return the value that needs a concrete type
     */
    @SuppressWarnings("unchecked")
    public <T> T getObject() {
        return (T) object;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public Field getField() {
        return field;
    }

    /**
     * @return the interface or union being resolved
     */
    public GraphQLType getFieldType() {
        return fieldType;
    }

    public GraphQLSchema getSchema() {
        return schema;
    }

    @SuppressWarnings("unchecked")
    public <T> T getContext() {
        return (T) context;
    }
}
