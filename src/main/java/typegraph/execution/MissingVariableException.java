package typegraph.execution;

import typegraph.PublicApi;

import java.util.List;

/**
 * Thrown when an argument refers to a variable that was not supplied, the argument has no default and its type is
 * non-null
 */
@PublicApi
public class MissingVariableException extends CoercionException {

    private final String variableName;

    public MissingVariableException(String variableName, List<Object> inputPath) {
        super(String.format("Variable '%s' was not provided and the value is required", variableName), inputPath);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
