package typegraph.schema;

import typegraph.Internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static typegraph.schema.GraphQLTypeUtil.simplePrint;

/**
 * Collects the named types reachable from the supplied roots into a name index, reporting names bound to
 * different definitions and references to names that were never defined.
 * <p>
 * Two instances carrying the same name are the same definition when they are structurally equal: the same kind, the
 * same fields with the same type signatures, arguments and defaults, the same interfaces, members or enum values,
 * and for scalars the same coercing. The first instance found is the one registered. Data fetchers and type
 * resolvers are behaviour and take no part in the comparison.
 */
@Internal
class SchemaTypeCollector implements TypeVisitor {

    private final Map<String, GraphQLType> typeMap = new LinkedHashMap<>();
    private final Set<String> referencedNames = new LinkedHashSet<>();
    private final List<String> problems = new ArrayList<>();

    Map<String, GraphQLType> collect(Collection<? extends GraphQLType> roots) {
        new SchemaTraverser().traverse(roots, this);
        for (String referencedName : referencedNames) {
            if (!typeMap.containsKey(referencedName)) {
                problems.add(String.format("Type '%s' is referenced but is not defined", referencedName));
            }
        }
        return typeMap;
    }

    List<String> getProblems() {
        return problems;
    }

    @Override
    public void visit(GraphQLType type) {
        if (type instanceof GraphQLTypeReference) {
            referencedNames.add(type.getName());
            return;
        }
        if (type instanceof GraphQLModifiedType) {
            return;
        }
        GraphQLType existing = typeMap.get(type.getName());
        if (existing == null) {
            typeMap.put(type.getName(), type);
        } else if (existing != type && !sameDefinition(existing, type)) {
            problems.add(String.format("Type '%s' is defined more than once with different definitions", type.getName()));
        }
    }

    static boolean sameDefinition(GraphQLType one, GraphQLType other) {
        if (one.getKind() != other.getKind() || !one.getName().equals(other.getName())) {
            return false;
        }
        switch (one.getKind()) {
            case SCALAR:
                return Objects.equals(((GraphQLScalarType) one).getCoercing(), ((GraphQLScalarType) other).getCoercing());
            case ENUM:
                return enumValues((GraphQLEnumType) one).equals(enumValues((GraphQLEnumType) other));
            case OBJECT:
                GraphQLObjectType oneObject = (GraphQLObjectType) one;
                GraphQLObjectType otherObject = (GraphQLObjectType) other;
                return typeNames(oneObject.getInterfaces()).equals(typeNames(otherObject.getInterfaces()))
                        && fieldSignatures(oneObject.getFieldDefinitions()).equals(fieldSignatures(otherObject.getFieldDefinitions()));
            case INTERFACE:
                return fieldSignatures(((GraphQLInterfaceType) one).getFieldDefinitions())
                        .equals(fieldSignatures(((GraphQLInterfaceType) other).getFieldDefinitions()));
            case UNION:
                return typeNames(((GraphQLUnionType) one).getTypes()).equals(typeNames(((GraphQLUnionType) other).getTypes()));
            case INPUT_OBJECT:
                return inputFieldSignatures((GraphQLInputObjectType) one).equals(inputFieldSignatures((GraphQLInputObjectType) other));
            default:
                return false;
        }
    }

    private static List<Object> enumValues(GraphQLEnumType enumType) {
        List<Object> values = new ArrayList<>();
        for (GraphQLEnumValueDefinition value : enumType.getValues()) {
            values.add(value.getName());
            values.add(value.getValue());
        }
        return values;
    }

    private static List<String> typeNames(List<? extends GraphQLType> types) {
        List<String> names = new ArrayList<>();
        for (GraphQLType type : types) {
            names.add(type.getName());
        }
        return names;
    }

    private static List<Object> fieldSignatures(List<GraphQLFieldDefinition> fieldDefinitions) {
        List<Object> signatures = new ArrayList<>();
        for (GraphQLFieldDefinition fieldDefinition : fieldDefinitions) {
            signatures.add(fieldDefinition.getName());
            signatures.add(simplePrint(fieldDefinition.getType()));
            for (GraphQLArgument argument : fieldDefinition.getArguments()) {
                signatures.add(argument.getName());
                signatures.add(simplePrint(argument.getType()));
                signatures.add(argument.hasDefaultValue());
                signatures.add(argument.getDefaultValue());
            }
        }
        return signatures;
    }

    private static List<Object> inputFieldSignatures(GraphQLInputObjectType inputObjectType) {
        List<Object> signatures = new ArrayList<>();
        for (GraphQLInputObjectField field : inputObjectType.getFields()) {
            signatures.add(field.getName());
            signatures.add(simplePrint(field.getType()));
            signatures.add(field.hasDefaultValue());
            signatures.add(field.getDefaultValue());
        }
        return signatures;
    }
}
