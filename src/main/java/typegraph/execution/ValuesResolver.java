package typegraph.execution;

import typegraph.GraphQLException;
import typegraph.Internal;
import typegraph.language.Argument;
import typegraph.language.ListValue;
import typegraph.language.NullValue;
import typegraph.language.ObjectField;
import typegraph.language.ObjectValue;
import typegraph.language.Value;
import typegraph.language.VariableDefinition;
import typegraph.language.VariableReference;
import typegraph.schema.GraphQLArgument;
import typegraph.schema.GraphQLEnumType;
import typegraph.schema.GraphQLInputObjectField;
import typegraph.schema.GraphQLInputObjectType;
import typegraph.schema.GraphQLInputType;
import typegraph.schema.GraphQLList;
import typegraph.schema.GraphQLNonNull;
import typegraph.schema.GraphQLScalarType;
import typegraph.schema.GraphQLSchema;
import typegraph.schema.GraphQLType;
import typegraph.schema.GraphQLTypeUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static typegraph.Assert.assertShouldNeverHappen;

/**
 * Coerces argument literals and variable values into the internal values resolvers see.
 * <p>
 * Literals go through {@code parseLiteral} of scalar and enum types, variable values through {@code parseValue}.
 * A variable is coerced against the type of the argument position it is used in, when that position is reached.
 * A variable default supplied by the operation is kept as a literal and coerced the same way.
 * <p>
 * Lists and input objects coerce every element and field before failing, so that all offending values are reported
 * together, each with its input path.
 */
@Internal
public class ValuesResolver {

    private final GraphQLSchema schema;
    private final UnknownInputFieldPolicy unknownInputFieldPolicy;

    public ValuesResolver(GraphQLSchema schema, UnknownInputFieldPolicy unknownInputFieldPolicy) {
        this.schema = schema;
        this.unknownInputFieldPolicy = unknownInputFieldPolicy;
    }

    /**
     * Adds the defaults of the declared variables the caller did not supply. Defaults stay literals until a use
     * site coerces them.
     *
     * @param variableDefinitions the variables the operation declares
     * @param inputs              the variable values supplied by the caller
     *
     * @return the variables in effect for the operation
     */
    public Map<String, Object> applyVariableDefaults(List<VariableDefinition> variableDefinitions, Map<String, Object> inputs) {
        Map<String, Object> variables = new LinkedHashMap<>(inputs);
        for (VariableDefinition variableDefinition : variableDefinitions) {
            if (!variables.containsKey(variableDefinition.getName()) && variableDefinition.getDefaultValue() != null) {
                variables.put(variableDefinition.getName(), variableDefinition.getDefaultValue());
            }
        }
        return variables;
    }

    /**
     * Coerces the arguments of a field or directive.
     * <p>
     * An absent argument takes its default when it has one. It is left out of the result when it has none and its
     * type is nullable, and it is a failure when its type is non-null.
     *
     * @param argumentDefinitions the declared arguments
     * @param arguments           the argument literals of the selection
     * @param variables           the variables of the operation
     *
     * @return the coerced argument values by name
     *
     * @throws CoercionException carrying every argument value that failed
     */
    public Map<String, Object> getArgumentValues(List<GraphQLArgument> argumentDefinitions, List<Argument> arguments, Map<String, Object> variables) {
        Map<String, Argument> argumentMap = new LinkedHashMap<>();
        for (Argument argument : arguments) {
            argumentMap.put(argument.getName(), argument);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        List<CoercionException> failures = new ArrayList<>();
        for (GraphQLArgument argumentDefinition : argumentDefinitions) {
            String argName = argumentDefinition.getName();
            List<Object> inputPath = new ArrayList<>();
            inputPath.add(argName);
            try {
                Argument argument = argumentMap.get(argName);
                if (argument == null) {
                    absentValue(result, argName, argumentDefinition.getType(), argumentDefinition.hasDefaultValue(), argumentDefinition.getDefaultValue(), inputPath);
                } else if (argument.getValue() instanceof VariableReference) {
                    String variableName = ((VariableReference) argument.getValue()).getName();
                    if (variables.containsKey(variableName)) {
                        result.put(argName, coerceVariable(argumentDefinition.getType(), variables.get(variableName), variables, inputPath));
                    } else if (argumentDefinition.hasDefaultValue()) {
                        result.put(argName, argumentDefinition.getDefaultValue());
                    } else if (GraphQLTypeUtil.isNonNull(argumentDefinition.getType())) {
                        throw new MissingVariableException(variableName, inputPath);
                    }
                } else {
                    result.put(argName, coerceValueAst(argumentDefinition.getType(), argument.getValue(), variables, inputPath));
                }
            } catch (CoercionException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw CoercionException.aggregate(failures);
        }
        return result;
    }

    private void absentValue(Map<String, Object> result, String name, GraphQLInputType type, boolean hasDefault, Object defaultValue, List<Object> inputPath) {
        if (hasDefault) {
            result.put(name, defaultValue);
        } else if (GraphQLTypeUtil.isNonNull(type)) {
            throw new CoercionException(String.format("Value for '%s' of non-null type '%s' is missing", name, GraphQLTypeUtil.simplePrint(type)), inputPath);
        }
    }

    private Object coerceVariable(GraphQLInputType type, Object variableValue, Map<String, Object> variables, List<Object> inputPath) {
        if (variableValue instanceof Value) {
            return coerceValueAst(type, (Value) variableValue, variables, inputPath);
        }
        return coerceValue(type, variableValue, inputPath);
    }

    /**
     * Coerces a literal of the query document to the given input type
     *
     * @param type      the input type of the position
     * @param inputValue the literal
     * @param variables the variables of the operation, for variable references nested in the literal
     * @param inputPath the input path of the literal
     *
     * @return the internal value
     *
     * @throws CoercionException if the literal doesn't fit the type
     */
    public Object coerceValueAst(GraphQLInputType type, Value inputValue, Map<String, Object> variables, List<Object> inputPath) {
        if (inputValue instanceof VariableReference) {
            String variableName = ((VariableReference) inputValue).getName();
            if (variables.containsKey(variableName)) {
                return coerceVariable(type, variables.get(variableName), variables, inputPath);
            }
            if (GraphQLTypeUtil.isNonNull(type)) {
                throw new MissingVariableException(variableName, inputPath);
            }
            return null;
        }
        GraphQLType resolved = schema.resolve(type);
        if (resolved instanceof GraphQLNonNull) {
            if (inputValue == null || inputValue instanceof NullValue) {
                throw nullForNonNull(resolved, inputPath);
            }
            return coerceValueAst((GraphQLInputType) ((GraphQLNonNull) resolved).getWrappedType(), inputValue, variables, inputPath);
        }
        if (inputValue == null || inputValue instanceof NullValue) {
            return null;
        }
        switch (resolved.getKind()) {
            case SCALAR:
                return parseLiteral((GraphQLScalarType) resolved, inputValue, inputPath);
            case ENUM:
                return parseLiteral((GraphQLEnumType) resolved, inputValue, inputPath);
            case LIST:
                return coerceListAst((GraphQLList) resolved, inputValue, variables, inputPath);
            case INPUT_OBJECT:
                return coerceObjectAst((GraphQLInputObjectType) resolved, inputValue, variables, inputPath);
            default:
                return assertShouldNeverHappen("'" + resolved.getName() + "' is not an input type");
        }
    }

    private Object parseLiteral(GraphQLScalarType scalarType, Value inputValue, List<Object> inputPath) {
        try {
            Object value = scalarType.getCoercing().parseLiteral(inputValue);
            if (value == null) {
                throw new CoercionException(String.format("Literal '%s' is not a valid '%s'", inputValue, scalarType.getName()), inputPath);
            }
            return value;
        } catch (GraphQLException e) {
            throw rethrow(e, inputPath);
        } catch (RuntimeException e) {
            throw new CoercionException(String.format("Literal '%s' is not a valid '%s': %s", inputValue, scalarType.getName(), e.getMessage()), inputPath, e);
        }
    }

    private Object parseLiteral(GraphQLEnumType enumType, Value inputValue, List<Object> inputPath) {
        try {
            return enumType.parseLiteral(inputValue);
        } catch (GraphQLException e) {
            throw rethrow(e, inputPath);
        } catch (RuntimeException e) {
            throw new CoercionException(String.format("Literal '%s' is not a valid '%s': %s", inputValue, enumType.getName(), e.getMessage()), inputPath, e);
        }
    }

    private List<Object> coerceListAst(GraphQLList listType, Value inputValue, Map<String, Object> variables, List<Object> inputPath) {
        GraphQLInputType elementType = (GraphQLInputType) listType.getWrappedType();
        List<Object> result = new ArrayList<>();
        if (!(inputValue instanceof ListValue)) {
            result.add(coerceValueAst(elementType, inputValue, variables, inputPath));
            return result;
        }
        List<CoercionException> failures = new ArrayList<>();
        List<Value> values = ((ListValue) inputValue).getValues();
        for (int i = 0; i < values.size(); i++) {
            try {
                result.add(coerceValueAst(elementType, values.get(i), variables, append(inputPath, i)));
            } catch (CoercionException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw CoercionException.aggregate(failures);
        }
        return result;
    }

    private Map<String, Object> coerceObjectAst(GraphQLInputObjectType inputObjectType, Value inputValue, Map<String, Object> variables, List<Object> inputPath) {
        if (!(inputValue instanceof ObjectValue)) {
            throw new CoercionException(String.format("Expected an object literal for input type '%s' but was '%s'", inputObjectType.getName(), inputValue), inputPath);
        }
        Map<String, Value> provided = new LinkedHashMap<>();
        for (ObjectField objectField : ((ObjectValue) inputValue).getObjectFields()) {
            provided.put(objectField.getName(), objectField.getValue());
        }
        List<CoercionException> failures = new ArrayList<>();
        checkUnknownFields(inputObjectType, provided.keySet(), inputPath, failures);

        Map<String, Object> result = new LinkedHashMap<>();
        for (GraphQLInputObjectField field : inputObjectType.getFields()) {
            List<Object> fieldPath = append(inputPath, field.getName());
            try {
                Value fieldValue = provided.get(field.getName());
                boolean absentVariable = fieldValue instanceof VariableReference && !variables.containsKey(((VariableReference) fieldValue).getName());
                if (fieldValue == null || (absentVariable && field.hasDefaultValue())) {
                    absentValue(result, field.getName(), field.getType(), field.hasDefaultValue(), field.getDefaultValue(), fieldPath);
                } else if (!absentVariable || GraphQLTypeUtil.isNonNull(field.getType())) {
                    result.put(field.getName(), coerceValueAst(field.getType(), fieldValue, variables, fieldPath));
                }
            } catch (CoercionException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw CoercionException.aggregate(failures);
        }
        return result;
    }

    /**
     * Coerces an external value, as supplied for a variable, to the given input type
     *
     * @param type      the input type of the position
     * @param value     the raw value: maps for input objects, collections or arrays for lists
     * @param inputPath the input path of the value
     *
     * @return the internal value
     *
     * @throws CoercionException if the value doesn't fit the type
     */
    public Object coerceValue(GraphQLInputType type, Object value, List<Object> inputPath) {
        GraphQLType resolved = schema.resolve(type);
        if (resolved instanceof GraphQLNonNull) {
            if (value == null) {
                throw nullForNonNull(resolved, inputPath);
            }
            return coerceValue((GraphQLInputType) ((GraphQLNonNull) resolved).getWrappedType(), value, inputPath);
        }
        if (value == null) {
            return null;
        }
        switch (resolved.getKind()) {
            case SCALAR:
                return parseValue((GraphQLScalarType) resolved, value, inputPath);
            case ENUM:
                try {
                    return ((GraphQLEnumType) resolved).parseValue(value);
                } catch (GraphQLException e) {
                    throw rethrow(e, inputPath);
                } catch (RuntimeException e) {
                    throw new CoercionException(String.format("Value '%s' is not a valid '%s': %s", value, resolved.getName(), e.getMessage()), inputPath, e);
                }
            case LIST:
                return coerceListValue((GraphQLList) resolved, value, inputPath);
            case INPUT_OBJECT:
                return coerceObjectValue((GraphQLInputObjectType) resolved, value, inputPath);
            default:
                return assertShouldNeverHappen("'" + resolved.getName() + "' is not an input type");
        }
    }

    private Object parseValue(GraphQLScalarType scalarType, Object value, List<Object> inputPath) {
        try {
            Object parsed = scalarType.getCoercing().parseValue(value);
            if (parsed == null) {
                throw new CoercionException(String.format("Value '%s' is not a valid '%s'", value, scalarType.getName()), inputPath);
            }
            return parsed;
        } catch (GraphQLException e) {
            throw rethrow(e, inputPath);
        } catch (RuntimeException e) {
            throw new CoercionException(String.format("Value '%s' is not a valid '%s': %s", value, scalarType.getName(), e.getMessage()), inputPath, e);
        }
    }

    private List<Object> coerceListValue(GraphQLList listType, Object value, List<Object> inputPath) {
        GraphQLInputType elementType = (GraphQLInputType) listType.getWrappedType();
        List<Object> result = new ArrayList<>();
        Collection<Object> elements = toCollection(value);
        if (elements == null) {
            result.add(coerceValue(elementType, value, inputPath));
            return result;
        }
        List<CoercionException> failures = new ArrayList<>();
        int i = 0;
        for (Object element : elements) {
            try {
                result.add(coerceValue(elementType, element, append(inputPath, i)));
            } catch (CoercionException e) {
                failures.add(e);
            }
            i++;
        }
        if (!failures.isEmpty()) {
            throw CoercionException.aggregate(failures);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> coerceObjectValue(GraphQLInputObjectType inputObjectType, Object value, List<Object> inputPath) {
        if (!(value instanceof Map)) {
            throw new CoercionException(String.format("Expected a map for input type '%s' but was '%s'", inputObjectType.getName(), value.getClass().getSimpleName()), inputPath);
        }
        Map<String, Object> provided = (Map<String, Object>) value;
        List<CoercionException> failures = new ArrayList<>();
        checkUnknownFields(inputObjectType, provided.keySet(), inputPath, failures);

        Map<String, Object> result = new LinkedHashMap<>();
        for (GraphQLInputObjectField field : inputObjectType.getFields()) {
            List<Object> fieldPath = append(inputPath, field.getName());
            try {
                if (provided.containsKey(field.getName())) {
                    result.put(field.getName(), coerceValue(field.getType(), provided.get(field.getName()), fieldPath));
                } else {
                    absentValue(result, field.getName(), field.getType(), field.hasDefaultValue(), field.getDefaultValue(), fieldPath);
                }
            } catch (CoercionException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            throw CoercionException.aggregate(failures);
        }
        return result;
    }

    private void checkUnknownFields(GraphQLInputObjectType inputObjectType, Collection<String> providedNames, List<Object> inputPath, List<CoercionException> failures) {
        if (unknownInputFieldPolicy == UnknownInputFieldPolicy.IGNORE) {
            return;
        }
        for (String providedName : providedNames) {
            if (inputObjectType.getField(providedName) == null) {
                failures.add(new CoercionException(String.format("Input type '%s' has no field '%s'", inputObjectType.getName(), providedName), append(inputPath, providedName)));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Collection<Object> toCollection(Object value) {
        if (value instanceof Collection) {
            return (Collection<Object>) value;
        }
        if (value instanceof Object[]) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Object[]) value) {
                list.add(element);
            }
            return list;
        }
        return null;
    }

    private static CoercionException nullForNonNull(GraphQLType nonNullType, List<Object> inputPath) {
        return new CoercionException(String.format("Null value is not allowed for non-null type '%s'", GraphQLTypeUtil.simplePrint(nonNullType)), inputPath);
    }

    private static CoercionException rethrow(GraphQLException e, List<Object> inputPath) {
        if (e instanceof CoercionException) {
            return (CoercionException) e;
        }
        return new CoercionException(e.getMessage(), inputPath, e);
    }

    private static List<Object> append(List<Object> inputPath, Object segment) {
        List<Object> path = new ArrayList<>(inputPath);
        path.add(segment);
        return path;
    }
}
