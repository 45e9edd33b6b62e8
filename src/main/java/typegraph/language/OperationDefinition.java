package typegraph.language;

import typegraph.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static typegraph.Assert.assertNotNull;

@PublicApi
public class OperationDefinition implements Definition {

    public enum Operation {
        QUERY, MUTATION, SUBSCRIPTION
    }

    private final String name;
    private final Operation operation;
    private final List<VariableDefinition> variableDefinitions;
    private final SelectionSet selectionSet;
    private final SourceLocation sourceLocation;

    public OperationDefinition(String name, Operation operation, List<VariableDefinition> variableDefinitions, SelectionSet selectionSet, SourceLocation sourceLocation) {
        this.name = name;
        this.operation = assertNotNull(operation, "operation can't be null");
        this.variableDefinitions = Collections.unmodifiableList(new ArrayList<>(variableDefinitions));
        this.selectionSet = assertNotNull(selectionSet, "selectionSet can't be null");
        this.sourceLocation = sourceLocation;
    }

    public static OperationDefinition query(SelectionSet selectionSet) {
        return new OperationDefinition(null, Operation.QUERY, Collections.emptyList(), selectionSet, null);
    }

    public static OperationDefinition mutation(SelectionSet selectionSet) {
        return new OperationDefinition(null, Operation.MUTATION, Collections.emptyList(), selectionSet, null);
    }

    public String getName() {
        return name;
    }

    public Operation getOperation() {
        return operation;
    }

    public List<VariableDefinition> getVariableDefinitions() {
        return variableDefinitions;
    }

    public SelectionSet getSelectionSet() {
        return selectionSet;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return sourceLocation;
    }

    @Override
    public String toString() {
        return "OperationDefinition{" +
                "name='" + name + '\'' +
                ", operation=" + operation +
                ", variableDefinitions=" + variableDefinitions +
                ", selectionSet=" + selectionSet +
                '}';
    }
}
