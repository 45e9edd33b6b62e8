package typegraph.execution;

import typegraph.PublicApi;
import typegraph.language.Field;
import typegraph.schema.GraphQLFieldDefinition;
import typegraph.schema.GraphQLNonNull;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLOutputType;
import typegraph.schema.GraphQLTypeUtil;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static typegraph.Assert.assertNotNull;
import static typegraph.Assert.assertTrue;

/**
 * As the executor descends the query it records, per result position, the output type expected there, the field and
 * field definition that produced it, the coerced arguments, the path and the parent step. Non-null wrappers stay on
 * the type so that null handling can see them.
 */
@PublicApi
public class ExecutionStepInfo {

    private final GraphQLOutputType type;
    private final GraphQLFieldDefinition fieldDefinition;
    private final Field field;
    private final ExecutionPath path;
    private final ExecutionStepInfo parent;
    private final Map<String, Object> arguments;

    private ExecutionStepInfo(GraphQLOutputType type, GraphQLFieldDefinition fieldDefinition, Field field, ExecutionPath path, ExecutionStepInfo parent, Map<String, Object> arguments) {
        this.type = assertNotNull(type, "you must provide a graphql type");
        this.fieldDefinition = fieldDefinition;
        this.field = field;
        this.path = path;
        this.parent = parent;
        this.arguments = arguments;
    }

    /**
     * @return the type of this step, possibly wrapped in list and non-null
     */
    public GraphQLOutputType getType() {
        return type;
    }

    /**
     * @return the type of this step with a non-null wrapper removed
     */
    public GraphQLOutputType getUnwrappedNonNullType() {
        return (GraphQLOutputType) GraphQLTypeUtil.unwrapNonNull(type);
    }

    @SuppressWarnings("unchecked")
    public <T extends GraphQLOutputType> T castType(Class<T> clazz) {
        assertTrue(clazz.isInstance(type), String.format("You have asked for a type of '%s' but the step holds '%s'", clazz.getName(), GraphQLTypeUtil.simplePrint(type)));
        return (T) type;
    }

    public boolean isNonNullType() {
        return GraphQLTypeUtil.isNonNull(type);
    }

    public boolean isListType() {
        return GraphQLTypeUtil.isList(GraphQLTypeUtil.unwrapNonNull(type));
    }

    public GraphQLFieldDefinition getFieldDefinition() {
        return fieldDefinition;
    }

    public Field getField() {
        return field;
    }

    public ExecutionPath getPath() {
        return path;
    }

    public ExecutionStepInfo getParent() {
        return parent;
    }

    public boolean hasParent() {
        return parent != null;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    /**
     * Used when an abstract type has been resolved to a concrete object type. The non-null wrapper, if any, is kept.
     *
     * @param objectType the resolved object type
     *
     * @return a new step info describing the concrete type
     */
    public ExecutionStepInfo changeTypeWithPreservedNonNull(GraphQLObjectType objectType) {
        GraphQLOutputType newType = isNonNullType() ? GraphQLNonNull.nonNull(objectType) : objectType;
        return new ExecutionStepInfo(newType, fieldDefinition, field, path, parent, arguments);
    }

    @Override
    public String toString() {
        return "ExecutionStepInfo{" +
                "path=" + path +
                ", type=" + GraphQLTypeUtil.simplePrint(type) +
                '}';
    }

    public static Builder newExecutionStepInfo() {
        return new Builder();
    }

    public static Builder newExecutionStepInfo(ExecutionStepInfo existing) {
        return new Builder(existing);
    }

    @PublicApi
    public static class Builder {
        private GraphQLOutputType type;
        private GraphQLFieldDefinition fieldDefinition;
        private Field field;
        private ExecutionPath path = ExecutionPath.rootPath();
        private ExecutionStepInfo parent;
        private Map<String, Object> arguments = Collections.emptyMap();

        public Builder() {
        }

        public Builder(ExecutionStepInfo existing) {
            this.type = existing.type;
            this.fieldDefinition = existing.fieldDefinition;
            this.field = existing.field;
            this.path = existing.path;
            this.parent = existing.parent;
            this.arguments = existing.arguments;
        }

        public Builder type(GraphQLOutputType type) {
            this.type = type;
            return this;
        }

        public Builder fieldDefinition(GraphQLFieldDefinition fieldDefinition) {
            this.fieldDefinition = fieldDefinition;
            return this;
        }

        public Builder field(Field field) {
            this.field = field;
            return this;
        }

        public Builder path(ExecutionPath path) {
            this.path = path;
            return this;
        }

        public Builder parentInfo(ExecutionStepInfo parent) {
            this.parent = parent;
            return this;
        }

        public Builder arguments(Map<String, Object> arguments) {
            this.arguments = arguments == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
            return this;
        }

        public ExecutionStepInfo build() {
            return new ExecutionStepInfo(type, fieldDefinition, field, path, parent, arguments);
        }
    }
}
