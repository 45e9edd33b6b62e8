package typegraph;

/**
 * All the errors in the engine belong to one of these categories
 */
@PublicApi
public enum ErrorType {
    CoercionError,
    ResolverError,
    AbstractResolutionError,
    FieldNotFound,
    NullValueInNonNullableField,
    SerializationError,
    TypeMismatch,
    ExecutionAborted,
    OperationNotSupported
}
