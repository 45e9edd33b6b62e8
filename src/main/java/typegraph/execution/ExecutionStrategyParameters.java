package typegraph.execution;

import typegraph.PublicApi;
import typegraph.language.Field;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static typegraph.Assert.assertNotNull;

/**
 * The parameters that are passed to execution strategies
 */
@PublicApi
public class ExecutionStrategyParameters {
    private final ExecutionStepInfo executionStepInfo;
    private final Object source;
    private final Map<String, List<Field>> fields;
    private final List<Field> currentField;
    private final ExecutionPath path;
    private final ExecutionStrategyParameters parent;

    private ExecutionStrategyParameters(ExecutionStepInfo executionStepInfo,
                                        Object source,
                                        Map<String, List<Field>> fields,
                                        List<Field> currentField,
                                        ExecutionPath path,
                                        ExecutionStrategyParameters parent) {
        this.executionStepInfo = assertNotNull(executionStepInfo, "executionStepInfo is null");
        this.fields = assertNotNull(fields, "fields is null");
        this.source = source;
        this.currentField = currentField;
        this.path = path;
        this.parent = parent;
    }

    public ExecutionStepInfo getExecutionStepInfo() {
        return executionStepInfo;
    }

    public Object getSource() {
        return source;
    }

    /**
     * @return the fields to execute, by response key, in selection order
     */
    public Map<String, List<Field>> getFields() {
        return fields;
    }

    public ExecutionPath getPath() {
        return path;
    }

    public ExecutionStrategyParameters getParent() {
        return parent;
    }

    /**
     * This returns the current field in its query representations.  Multiple fields may share a response key when
     * they are merged through fragments, the first one is representative.
     *
     * @return the current merged fields
     */
    public List<Field> getField() {
        return currentField;
    }

    public ExecutionStrategyParameters transform(Consumer<Builder> builderConsumer) {
        Builder builder = newParameters(this);
        builderConsumer.accept(builder);
        return builder.build();
    }

    @Override
    public String toString() {
        return String.format("ExecutionStrategyParameters { path=%s, executionStepInfo=%s, source=%s, fields=%s }",
                path, executionStepInfo, source, fields.keySet());
    }

    public static Builder newParameters() {
        return new Builder();
    }

    public static Builder newParameters(ExecutionStrategyParameters oldParameters) {
        return new Builder(oldParameters);
    }

    public static class Builder {
        ExecutionStepInfo executionStepInfo;
        Object source;
        Map<String, List<Field>> fields = Collections.emptyMap();
        List<Field> currentField;
        ExecutionPath path = ExecutionPath.rootPath();
        ExecutionStrategyParameters parent;

        /**
         * @see ExecutionStrategyParameters#newParameters()
         */
        private Builder() {
        }

        /**
         * @see ExecutionStrategyParameters#newParameters(ExecutionStrategyParameters)
         */
        private Builder(ExecutionStrategyParameters oldParameters) {
            this.executionStepInfo = oldParameters.executionStepInfo;
            this.source = oldParameters.source;
            this.fields = oldParameters.fields;
            this.currentField = oldParameters.currentField;
            this.path = oldParameters.path;
            this.parent = oldParameters.parent;
        }

        public Builder executionStepInfo(ExecutionStepInfo executionStepInfo) {
            this.executionStepInfo = executionStepInfo;
            return this;
        }

        public Builder executionStepInfo(ExecutionStepInfo.Builder executionStepInfoBuilder) {
            this.executionStepInfo = executionStepInfoBuilder.build();
            return this;
        }

        public Builder fields(Map<String, List<Field>> fields) {
            this.fields = fields;
            return this;
        }

        public Builder field(List<Field> currentField) {
            this.currentField = currentField;
            return this;
        }

        public Builder source(Object source) {
            this.source = source;
            return this;
        }

        public Builder path(ExecutionPath path) {
            this.path = path;
            return this;
        }

        public Builder parent(ExecutionStrategyParameters parent) {
            this.parent = parent;
            return this;
        }

        public ExecutionStrategyParameters build() {
            return new ExecutionStrategyParameters(executionStepInfo, source, fields, currentField, path, parent);
        }
    }
}
