package typegraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Internal
public class ExecutionResultImpl implements ExecutionResult {

    private final Object data;
    private final List<GraphQLError> errors;

    public ExecutionResultImpl(GraphQLError error) {
        this(null, Collections.singletonList(error));
    }

    public ExecutionResultImpl(List<? extends GraphQLError> errors) {
        this(null, errors);
    }

    public ExecutionResultImpl(Object data, List<? extends GraphQLError> errors) {
        this.data = data;
        if (errors != null && !errors.isEmpty()) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        } else {
            this.errors = Collections.emptyList();
        }
    }

    @Override
    public List<GraphQLError> getErrors() {
        return errors;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getData() {
        return (T) data;
    }

    @Override
    public Map<String, Object> toSpecification() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("data", data);
        result.put("errors", errors.stream().map(GraphQLError::toSpecification).collect(Collectors.toList()));
        return result;
    }

    @Override
    public String toString() {
        return "ExecutionResultImpl{" +
                "data=" + data +
                ", errors=" + errors +
                '}';
    }

    public static Builder newExecutionResult() {
        return new Builder();
    }

    public static class Builder {
        private Object data;
        private final List<GraphQLError> errors = new ArrayList<>();

        public Builder from(ExecutionResult executionResult) {
            data = executionResult.getData();
            errors.addAll(executionResult.getErrors());
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public Builder addErrors(List<? extends GraphQLError> errors) {
            this.errors.addAll(errors);
            return this;
        }

        public Builder addError(GraphQLError error) {
            this.errors.add(error);
            return this;
        }

        public ExecutionResultImpl build() {
            return new ExecutionResultImpl(data, errors);
        }
    }
}
