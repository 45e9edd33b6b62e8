package typegraph.schema;

import typegraph.Internal;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the structural rules of a collected schema: objects provide every field of the interfaces they declare with a
 * compatible type and identical arguments, union members are object types, and input and output positions hold
 * types of the right kind.
 */
@Internal
class SchemaValidator implements TypeVisitor {

    private final GraphQLSchema schema;
    private final List<String> problems = new ArrayList<>();

    SchemaValidator(GraphQLSchema schema) {
        this.schema = schema;
    }

    List<String> validate() {
        schema.traverse(this);
        return problems;
    }

    @Override
    public void visit(GraphQLType type) {
        if (type instanceof GraphQLObjectType) {
            GraphQLObjectType objectType = (GraphQLObjectType) type;
            checkFields(objectType);
            checkInterfaces(objectType);
        } else if (type instanceof GraphQLInterfaceType) {
            checkFields((GraphQLInterfaceType) type);
        } else if (type instanceof GraphQLUnionType) {
            checkUnion((GraphQLUnionType) type);
        } else if (type instanceof GraphQLInputObjectType) {
            for (GraphQLInputObjectField field : ((GraphQLInputObjectType) type).getFields()) {
                checkInputType(field.getType(), String.format("Input field '%s.%s'", type.getName(), field.getName()));
            }
        }
    }

    private void checkFields(GraphQLFieldsContainer container) {
        for (GraphQLFieldDefinition fieldDefinition : container.getFieldDefinitions()) {
            String fieldName = container.getName() + "." + fieldDefinition.getName();
            GraphQLType namedType = schema.resolve(GraphQLTypeUtil.unwrapAll(fieldDefinition.getType()));
            if (namedType.getKind() == TypeKind.INPUT_OBJECT) {
                problems.add(String.format("Field '%s' must have an output type but has input type '%s'", fieldName, namedType.getName()));
            }
            for (GraphQLArgument argument : fieldDefinition.getArguments()) {
                checkInputType(argument.getType(), String.format("Argument '%s' of field '%s'", argument.getName(), fieldName));
            }
        }
    }

    private void checkInputType(GraphQLType type, String position) {
        GraphQLType namedType = schema.resolve(GraphQLTypeUtil.unwrapAll(type));
        switch (namedType.getKind()) {
            case SCALAR:
            case ENUM:
            case INPUT_OBJECT:
                break;
            default:
                problems.add(String.format("%s must have an input type but has %s type '%s'", position, namedType.getKind(), namedType.getName()));
        }
    }

    private void checkInterfaces(GraphQLObjectType objectType) {
        for (GraphQLOutputType declared : objectType.getInterfaces()) {
            GraphQLType resolved = schema.resolve(declared);
            if (!(resolved instanceof GraphQLInterfaceType)) {
                problems.add(String.format("Object type '%s' declares '%s' as an interface but it is of kind %s", objectType.getName(), resolved.getName(), resolved.getKind()));
                continue;
            }
            GraphQLInterfaceType interfaceType = (GraphQLInterfaceType) resolved;
            for (GraphQLFieldDefinition interfaceField : interfaceType.getFieldDefinitions()) {
                checkInterfaceField(objectType, interfaceType, interfaceField);
            }
        }
    }

    private void checkInterfaceField(GraphQLObjectType objectType, GraphQLInterfaceType interfaceType, GraphQLFieldDefinition interfaceField) {
        GraphQLFieldDefinition objectField = objectType.getFieldDefinition(interfaceField.getName());
        if (objectField == null) {
            problems.add(String.format("Object type '%s' does not provide field '%s' required by interface '%s'", objectType.getName(), interfaceField.getName(), interfaceType.getName()));
            return;
        }
        if (!isSubType(objectField.getType(), interfaceField.getType())) {
            problems.add(String.format("Field '%s.%s' has type '%s' which is not compatible with '%s' required by interface '%s'",
                    objectType.getName(), objectField.getName(), GraphQLTypeUtil.simplePrint(objectField.getType()),
                    GraphQLTypeUtil.simplePrint(interfaceField.getType()), interfaceType.getName()));
        }
        for (GraphQLArgument interfaceArgument : interfaceField.getArguments()) {
            GraphQLArgument objectArgument = objectField.getArgument(interfaceArgument.getName());
            if (objectArgument == null || !sameType(objectArgument.getType(), interfaceArgument.getType())) {
                problems.add(String.format("Field '%s.%s' must accept argument '%s' of type '%s' as required by interface '%s'",
                        objectType.getName(), objectField.getName(), interfaceArgument.getName(),
                        GraphQLTypeUtil.simplePrint(interfaceArgument.getType()), interfaceType.getName()));
            }
        }
    }

    private void checkUnion(GraphQLUnionType unionType) {
        for (GraphQLOutputType member : unionType.getTypes()) {
            GraphQLType resolved = schema.resolve(member);
            if (!(resolved instanceof GraphQLObjectType)) {
                problems.add(String.format("Union '%s' member '%s' must be an object type but is of kind %s", unionType.getName(), resolved.getName(), resolved.getKind()));
            }
        }
    }

    private boolean isSubType(GraphQLType maybeSubType, GraphQLType superType) {
        if (superType instanceof GraphQLNonNull) {
            return maybeSubType instanceof GraphQLNonNull
                    && isSubType(((GraphQLNonNull) maybeSubType).getWrappedType(), ((GraphQLNonNull) superType).getWrappedType());
        }
        if (maybeSubType instanceof GraphQLNonNull) {
            return isSubType(((GraphQLNonNull) maybeSubType).getWrappedType(), superType);
        }
        if (superType instanceof GraphQLList) {
            return maybeSubType instanceof GraphQLList
                    && isSubType(((GraphQLList) maybeSubType).getWrappedType(), ((GraphQLList) superType).getWrappedType());
        }
        if (maybeSubType instanceof GraphQLList) {
            return false;
        }
        GraphQLType sub = schema.resolve(maybeSubType);
        GraphQLType sup = schema.resolve(superType);
        if (sub.getName().equals(sup.getName())) {
            return true;
        }
        return sub instanceof GraphQLObjectType && sup.getKind().isAbstract() && schema.isPossibleType(sup, (GraphQLObjectType) sub);
    }

    private boolean sameType(GraphQLType a, GraphQLType b) {
        if (a instanceof GraphQLModifiedType || b instanceof GraphQLModifiedType) {
            return a instanceof GraphQLModifiedType && b instanceof GraphQLModifiedType
                    && a.getKind() == b.getKind()
                    && sameType(((GraphQLModifiedType) a).getWrappedType(), ((GraphQLModifiedType) b).getWrappedType());
        }
        return a.getName().equals(b.getName());
    }
}
