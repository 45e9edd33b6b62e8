package typegraph.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import typegraph.ExecutionResult;
import typegraph.ExecutionResultImpl;
import typegraph.Internal;
import typegraph.PublicSpi;
import typegraph.execution.instrumentation.Instrumentation;
import typegraph.execution.instrumentation.InstrumentationContext;
import typegraph.execution.instrumentation.parameters.InstrumentationFieldFetchParameters;
import typegraph.introspection.Introspection;
import typegraph.language.Field;
import typegraph.schema.CoercingSerializeException;
import typegraph.schema.DataFetcher;
import typegraph.schema.DataFetchingEnvironment;
import typegraph.schema.GraphQLEnumType;
import typegraph.schema.GraphQLFieldDefinition;
import typegraph.schema.GraphQLList;
import typegraph.schema.GraphQLObjectType;
import typegraph.schema.GraphQLOutputType;
import typegraph.schema.GraphQLScalarType;
import typegraph.schema.GraphQLSchema;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static typegraph.Assert.assertShouldNeverHappen;
import static typegraph.execution.FieldCollectorParameters.newParameters;
import static typegraph.schema.DataFetchingEnvironmentImpl.newDataFetchingEnvironment;

/**
 * An execution strategy is give a list of fields from the graphql query to execute and find values for using a recursive strategy.
 * <pre>
 *     query {
 *          friends {
 *              id
 *              name
 *              friends {
 *                  id
 *                  name
 *              }
 *          }
 *          enemies {
 *              id
 *              name
 *              allies {
 *                  id
 *                  name
 *              }
 *          }
 *     }
 *
 * </pre>
 * <p>
 * Given the graphql query above, an execution strategy will be called for the top level fields 'friends' and 'enemies' and it will be asked to find an object
 * to describe them.  Because they are both complex object types, it needs to descend down that query and start fetching and completing
 * fields such as 'id','name' and other complex fields such as 'friends' and 'allies', by recursively calling to itself to execute these lower
 * field layers
 * <p>
 * The execution of a field has two phases, first a raw object must be fetched for a field via a {@link DataFetcher} which
 * is defined on the {@link GraphQLFieldDefinition}.  This object must then be 'completed' into a suitable value, either as a scalar/enum type via
 * coercion or if its a complex object type by recursively calling the execution strategy for the lower level fields.
 * <p>
 * The first phase (data fetching) is handled by the method {@link #fetchField(ExecutionContext, ExecutionStrategyParameters, ExecutionStepInfo)}
 * <p>
 * The second phase (value completion) is handled by the methods {@link #completeField(ExecutionContext, ExecutionStrategyParameters, ExecutionStepInfo, FetchedValue)}
 * and the other "completeXXX" methods.
 * <p>
 * A null where the type is non null raises a {@link NonNullableFieldWasNullException}. It travels up through the
 * completion of the enclosing positions until one of them is nullable, which then becomes null. Sibling fields and
 * list elements are always completed before the exception continues upwards, so their errors are recorded too.
 * <p>
 * {@link #execute(ExecutionContext, ExecutionStrategyParameters)} is the entry point of the execution strategy.
 */
@PublicSpi
public abstract class ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStrategy.class);

    protected final FieldCollector fieldCollector = new FieldCollector();
    protected final ResolveType resolveType = new ResolveType();

    protected final DataFetcherExceptionHandler dataFetcherExceptionHandler;
    protected final Scheduler fetchScheduler;

    /**
     * The default execution strategy constructor uses the {@link SimpleDataFetcherExceptionHandler}
     * for data fetching errors.
     */
    protected ExecutionStrategy() {
        this(new SimpleDataFetcherExceptionHandler());
    }

    /**
     * The consumers of the execution strategy can pass in a {@link DataFetcherExceptionHandler} to better
     * decide what do when a data fetching error happens
     *
     * @param dataFetcherExceptionHandler the callback invoked if an exception happens during data fetching
     */
    protected ExecutionStrategy(DataFetcherExceptionHandler dataFetcherExceptionHandler) {
        this(dataFetcherExceptionHandler, Schedulers.boundedElastic());
    }

    /**
     * @param dataFetcherExceptionHandler the callback invoked if an exception happens during data fetching
     * @param fetchScheduler              the scheduler data fetchers are invoked on, so that a blocking data
     *                                    fetcher can't hold up its siblings
     */
    protected ExecutionStrategy(DataFetcherExceptionHandler dataFetcherExceptionHandler, Scheduler fetchScheduler) {
        this.dataFetcherExceptionHandler = dataFetcherExceptionHandler;
        this.fetchScheduler = fetchScheduler;
    }

    @Internal
    public static String mkNameForPath(List<Field> currentField) {
        return currentField.get(0).getResultKey();
    }

    /**
     * This is the entry point to an execution strategy.  It will be passed the fields to execute and get values for.
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     *
     * @return a promise to an {@link ExecutionResult}
     *
     * @throws NonNullableFieldWasNullException in the mono if a non null field resolves to a null value
     */
    public abstract Mono<ExecutionResult> execute(ExecutionContext executionContext, ExecutionStrategyParameters parameters) throws NonNullableFieldWasNullException;

    /**
     * Called to fetch a value for a field and resolve it further in terms of the graphql query.  This will call
     * #fetchField followed by #completeField and the completed {@link ExecutionResult} is returned.
     * <p>
     * An execution strategy can iterate the fields to be executed and call this method for each one
     * <p>
     * Graphql fragments mean that for any give logical field can have one or more {@link Field} values associated with it
     * in the query, hence the fieldList.  However the first entry is representative of the field for most purposes.
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     *
     * @return a promise to an {@link ExecutionResult}
     *
     * @throws NonNullableFieldWasNullException in the mono if a non null field resolves to a null value
     */
    protected Mono<ExecutionResult> resolveField(ExecutionContext executionContext, ExecutionStrategyParameters parameters) {
        Field field = parameters.getField().get(0);
        GraphQLObjectType parentType = getParentType(parameters);
        GraphQLFieldDefinition fieldDef = getFieldDef(executionContext.getGraphQLSchema(), parentType, field);
        if (fieldDef == null) {
            handleFieldNotFoundProblem(executionContext, parameters, parentType);
            return Mono.just(nullResult());
        }

        Map<String, Object> argumentValues;
        try {
            argumentValues = executionContext.getValuesResolver().getArgumentValues(fieldDef.getArguments(),
                                                                                    field.getArguments(),
                                                                                    executionContext.getVariables());
        } catch (CoercionException e) {
            handleArgumentCoercionProblem(executionContext, parameters, e);
            argumentValues = null;
        }
        ExecutionStepInfo fieldStepInfo = fieldStepInfo(parameters, fieldDef, argumentValues);

        // a field whose arguments can't be coerced is not fetched, it completes as null
        Mono<FetchedValue> fetchedValue = argumentValues == null
                ? Mono.just(FetchedValue.nullValue())
                : fetchField(executionContext, parameters, fieldStepInfo);
        return fetchedValue.flatMap(value -> completeField(executionContext, parameters, fieldStepInfo, value));
    }

    /**
     * Called to fetch a value for a field from the {@link DataFetcher} associated with the field
     * {@link GraphQLFieldDefinition}.
     * <p>
     * Graphql fragments mean that for any give logical field can have one or more {@link Field} values associated with it
     * in the query, hence the fieldList.  However the first entry is representative of the field for most purposes.
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     * @param fieldStepInfo    the step info of the field, holding its definition and coerced arguments
     *
     * @return a promise to a fetched value, never empty
     */
    protected Mono<FetchedValue> fetchField(ExecutionContext executionContext, ExecutionStrategyParameters parameters, ExecutionStepInfo fieldStepInfo) {
        Field field = parameters.getField().get(0);
        GraphQLFieldDefinition fieldDef = fieldStepInfo.getFieldDefinition();
        Map<String, Object> argumentValues = fieldStepInfo.getArguments();

        DataFetchingEnvironment environment = newDataFetchingEnvironment(executionContext)
                .source(parameters.getSource())
                .arguments(argumentValues)
                .fieldDefinition(fieldDef)
                .fields(parameters.getField())
                .fieldType(fieldDef.getType())
                .executionStepInfo(fieldStepInfo)
                .parentType(getParentType(parameters))
                .build();

        Instrumentation instrumentation = executionContext.getInstrumentation();

        InstrumentationFieldFetchParameters instrumentationFieldFetchParams = new InstrumentationFieldFetchParameters(
                executionContext, fieldDef, environment, parameters);
        InstrumentationContext<Object> fetchCtx = instrumentation.beginFieldFetch(instrumentationFieldFetchParams);
        DataFetcher<?> dataFetcher = instrumentation.instrumentDataFetcher(fieldDef.getDataFetcher(), instrumentationFieldFetchParams);

        ExecutionId executionId = executionContext.getExecutionId();
        ExecutionPath path = parameters.getPath();

        Mono<Object> fetch = Mono.fromCallable(() -> {
            log.debug("'{}' fetching field '{}' using data fetcher '{}'...", executionId, path,
                      dataFetcher.getClass().getName());
            Object fetchedValueRaw = dataFetcher.get(environment);
            log.debug("'{}' field '{}' fetch returned '{}'", executionId, path,
                      fetchedValueRaw == null ? "null" : fetchedValueRaw.getClass().getName());
            return fetchedValueRaw;
        })
                                 .subscribeOn(fetchScheduler)
                                 .flatMap(Async::toMono);

        ExecutionDeadline deadline = executionContext.getDeadline();
        if (deadline != null) {
            Mono<Object> beforeDeadline = fetch;
            fetch = Mono.defer(() -> deadline.isExpired() ? Mono.<Object>error(deadline.newTimeoutException()) : beforeDeadline)
                        .timeout(deadline.whenExpired(), Mono.<Object>error(deadline::newTimeoutException));
        }

        return fetch
                .transform(fetchCtx::instrument)
                .doOnError(t -> log.debug("'{}', field '{}' fetch threw exception", executionId, path, t))
                .onErrorResume(t -> {
                    handleFetchingException(executionContext, parameters, field, fieldDef, argumentValues, environment, t);
                    return Mono.empty();
                })
                .map(result -> new FetchedValue(result, unboxPossibleOptional(unboxPossibleDataFetcherResult(executionContext, parameters, result))))
                .defaultIfEmpty(FetchedValue.nullValue());
    }

    Object unboxPossibleDataFetcherResult(ExecutionContext executionContext,
                                          ExecutionStrategyParameters parameters,
                                          Object result) {
        if (result instanceof DataFetcherResult) {
            DataFetcherResult<?> dataFetcherResult = (DataFetcherResult<?>) result;
            dataFetcherResult.getErrors().stream()
                             .map(relError -> new AbsoluteGraphQLError(parameters, relError))
                             .forEach(executionContext::addError);
            return dataFetcherResult.getData();
        } else {
            return result;
        }
    }

    private void handleFetchingException(ExecutionContext executionContext,
                                         ExecutionStrategyParameters parameters,
                                         Field field,
                                         GraphQLFieldDefinition fieldDef,
                                         Map<String, Object> argumentValues,
                                         DataFetchingEnvironment environment,
                                         Throwable e) {
        DataFetcherExceptionHandlerParameters handlerParameters = DataFetcherExceptionHandlerParameters.newExceptionParameters()
                                                                                                       .executionContext(executionContext)
                                                                                                       .dataFetchingEnvironment(environment)
                                                                                                       .argumentValues(argumentValues)
                                                                                                       .field(field)
                                                                                                       .fieldDefinition(fieldDef)
                                                                                                       .path(parameters.getPath())
                                                                                                       .exception(e)
                                                                                                       .build();

        dataFetcherExceptionHandler.accept(handlerParameters);
    }

    /**
     * Called to complete a field based on the type of the field.
     * <p>
     * If the field is a scalar type, then it will be coerced  and returned.  However if the field type is an complex object type, then
     * the execution strategy will be called recursively again to execute the fields of that type before returning.
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     * @param fieldStepInfo    the step info of the field
     * @param fetchedValue     the fetched raw value
     *
     * @return a promise to an {@link ExecutionResult}
     *
     * @throws NonNullableFieldWasNullException in the mono if a non null field resolves to a null value
     */
    protected Mono<ExecutionResult> completeField(ExecutionContext executionContext, ExecutionStrategyParameters parameters, ExecutionStepInfo fieldStepInfo, FetchedValue fetchedValue) {
        ExecutionStrategyParameters newParameters = parameters.transform(builder ->
                                                                                 builder.executionStepInfo(fieldStepInfo)
                                                                                        .source(fetchedValue.getFetchedValue())
        );

        log.debug("'{}' completing field '{}'...", executionContext.getExecutionId(), fieldStepInfo.getPath());

        return completeValue(executionContext, newParameters);
    }

    /**
     * Called to complete a value for a field based on the type of the field.
     * <p>
     * If the type of the position is non null and the completed value is null, the error is recorded and the
     * returned mono fails with {@link NonNullableFieldWasNullException}. If the type is nullable, such a failure
     * coming from below is turned into a null value for this position.
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     *
     * @return a promise to an {@link ExecutionResult}
     *
     * @throws NonNullableFieldWasNullException in the mono if a non null field resolves to a null value
     */
    protected Mono<ExecutionResult> completeValue(ExecutionContext executionContext, ExecutionStrategyParameters parameters) throws NonNullableFieldWasNullException {
        ExecutionStepInfo executionStepInfo = parameters.getExecutionStepInfo();
        if (executionStepInfo.isNonNullType()) {
            NonNullableFieldValidator nonNullableFieldValidator = new NonNullableFieldValidator(executionContext, executionStepInfo);
            return completeValueForType(executionContext, parameters)
                    .map(result -> {
                        Object data = result.getData();
                        nonNullableFieldValidator.validate(parameters.getPath(), data);
                        return result;
                    });
        }
        return completeValueForType(executionContext, parameters)
                .onErrorResume(NonNullableFieldWasNullException.class, e -> {
                    log.debug("'{}' null at non null '{}' makes '{}' null", executionContext.getExecutionId(),
                              e.getPath(), parameters.getPath());
                    return Mono.just(nullResult());
                });
    }

    private Mono<ExecutionResult> completeValueForType(ExecutionContext executionContext, ExecutionStrategyParameters parameters) {
        Object result = unboxPossibleOptional(parameters.getSource());
        if (result == null) {
            return Mono.just(nullResult());
        }
        GraphQLOutputType fieldType = executionContext.getGraphQLSchema().resolve(parameters.getExecutionStepInfo().getUnwrappedNonNullType());
        switch (fieldType.getKind()) {
            case LIST:
                return completeValueForList(executionContext, parameters, result);
            case SCALAR:
                return completeValueForScalar(executionContext, parameters, (GraphQLScalarType) fieldType, result);
            case ENUM:
                return completeValueForEnum(executionContext, parameters, (GraphQLEnumType) fieldType, result);
            case OBJECT:
            case INTERFACE:
            case UNION:
                // when we are here, we have a complex type: Interface, Union or Object
                // and we must go deeper
                return resolveType(executionContext, parameters, fieldType, result)
                        .flatMap(resolvedObjectType -> completeValueForObject(executionContext, parameters, resolvedObjectType, result))
                        .onErrorResume(UnresolvedTypeException.class, e -> handleUnresolvedTypeProblem(executionContext, parameters, e));
            default:
                return assertShouldNeverHappen("'" + fieldType.getName() + "' is not an output type");
        }
    }

    private Mono<ExecutionResult> handleUnresolvedTypeProblem(ExecutionContext context, ExecutionStrategyParameters parameters, UnresolvedTypeException e) {
        UnresolvedTypeError error = new UnresolvedTypeError(parameters.getPath(), e);
        log.warn(error.getMessage(), e);
        context.addError(error);
        return Mono.just(nullResult());
    }

    /**
     * Called to complete a list of value for a field based on a list type.  This iterates the values and calls
     * {@link #completeValue(ExecutionContext, ExecutionStrategyParameters)} for each value, concurrently.
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     * @param result           the result to complete, raw result
     *
     * @return a promise to an {@link ExecutionResult}
     */
    protected Mono<ExecutionResult> completeValueForList(ExecutionContext executionContext, ExecutionStrategyParameters parameters, Object result) {
        List<Object> values = toList(executionContext, parameters, result);
        if (values == null) {
            return Mono.just(nullResult());
        }
        ExecutionStepInfo executionStepInfo = parameters.getExecutionStepInfo();
        GraphQLList listType = executionContext.getGraphQLSchema().resolve(executionStepInfo.getUnwrappedNonNullType());
        GraphQLOutputType elementType = (GraphQLOutputType) listType.getWrappedType();

        return Async.each(values, (index, item) -> {
            ExecutionPath indexedPath = parameters.getPath().segment(index);

            ExecutionStepInfo elementStepInfo = ExecutionStepInfo.newExecutionStepInfo()
                                                                 .parentInfo(executionStepInfo)
                                                                 .type(elementType)
                                                                 .path(indexedPath)
                                                                 .fieldDefinition(executionStepInfo.getFieldDefinition())
                                                                 .field(executionStepInfo.getField())
                                                                 .arguments(executionStepInfo.getArguments())
                                                                 .build();

            ExecutionStrategyParameters newParameters = parameters.transform(builder ->
                                                                                     builder.executionStepInfo(elementStepInfo)
                                                                                            .path(indexedPath)
                                                                                            .source(item)
            );
            return completeValue(executionContext, newParameters);
        })
                    .collectList()
                    .map(completedResults -> {
                        List<Object> data = new ArrayList<>(completedResults.size());
                        for (ExecutionResult completedResult : completedResults) {
                            data.add(completedResult.getData());
                        }
                        return new ExecutionResultImpl(data, null);
                    });
    }

    /**
     * Called to turn an object into a scalar value according to the {@link GraphQLScalarType} by asking that scalar type to coerce the object
     * into a valid value
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     * @param scalarType       the type of the scalar
     * @param result           the result to be coerced
     *
     * @return a promise to an {@link ExecutionResult}
     */
    protected Mono<ExecutionResult> completeValueForScalar(ExecutionContext executionContext,
                                                           ExecutionStrategyParameters parameters,
                                                           GraphQLScalarType scalarType,
                                                           Object result) {
        Object serialized;
        try {
            serialized = scalarType.getCoercing().serialize(result);
        } catch (CoercingSerializeException e) {
            serialized = handleCoercionProblem(executionContext, parameters, e);
        } catch (RuntimeException e) {
            CoercingSerializeException wrapped = new CoercingSerializeException(
                    String.format("Serializing '%s' as '%s' failed: %s", result, scalarType.getName(), e.getMessage()), e);
            serialized = handleCoercionProblem(executionContext, parameters, wrapped);
        }
        //6.6.1 http://facebook.github.io/graphql/#sec-Field-entries
        if (serialized instanceof Double && ((Double) serialized).isNaN()) {
            serialized = null;
        }
        return Mono.just(new ExecutionResultImpl(serialized, null));
    }

    /**
     * Called to turn an object into a enum value according to the {@link GraphQLEnumType} by asking that enum type to coerce the object into a valid value
     *
     * @param executionContext contains the top level execution parameters
     * @param parameters       contains the parameters holding the fields to be executed and source object
     * @param enumType         the type of the enum
     * @param result           the result to be coerced
     *
     * @return a promise to an {@link ExecutionResult}
     */
    protected Mono<ExecutionResult> completeValueForEnum(ExecutionContext executionContext, ExecutionStrategyParameters parameters, GraphQLEnumType enumType, Object result) {
        Object serialized;
        try {
            serialized = enumType.serialize(result);
        } catch (CoercingSerializeException e) {
            serialized = handleCoercionProblem(executionContext, parameters, e);
        } catch (RuntimeException e) {
            CoercingSerializeException wrapped = new CoercingSerializeException(
                    String.format("Serializing '%s' as '%s' failed: %s", result, enumType.getName(), e.getMessage()), e);
            serialized = handleCoercionProblem(executionContext, parameters, wrapped);
        }
        return Mono.just(new ExecutionResultImpl(serialized, null));
    }

    /**
     * Called to turn an java object value into an graphql object value
     *
     * @param executionContext   contains the top level execution parameters
     * @param parameters         contains the parameters holding the fields to be executed and source object
     * @param resolvedObjectType the resolved object type
     * @param result             the result to be coerced
     *
     * @return a promise to an {@link ExecutionResult}
     */
    protected Mono<ExecutionResult> completeValueForObject(ExecutionContext executionContext, ExecutionStrategyParameters parameters, GraphQLObjectType resolvedObjectType, Object result) {
        FieldCollectorParameters collectorParameters = newParameters()
                .schema(executionContext.getGraphQLSchema())
                .objectType(resolvedObjectType)
                .fragments(executionContext.getFragmentsByName())
                .variables(executionContext.getVariables())
                .valuesResolver(executionContext.getValuesResolver())
                .build();

        Map<String, List<Field>> subFields = fieldCollector.collectFields(collectorParameters, parameters.getField());

        ExecutionStepInfo newStepInfo = parameters.getExecutionStepInfo().changeTypeWithPreservedNonNull(resolvedObjectType);

        ExecutionStrategyParameters newParameters = parameters.transform(builder ->
                                                                                 builder.executionStepInfo(newStepInfo)
                                                                                        .fields(subFields)
                                                                                        .source(result)
        );

        // Calling this from the executionContext to ensure we shift back from mutation strategy to the query strategy.
        return executionContext.getQueryStrategy().execute(executionContext, newParameters);
    }

    @SuppressWarnings("SameReturnValue")
    private Object handleCoercionProblem(ExecutionContext context, ExecutionStrategyParameters parameters, CoercingSerializeException e) {
        SerializationError error = new SerializationError(parameters.getPath(), e);
        log.warn(error.getMessage(), e);
        context.addError(error);
        return null;
    }

    private void handleFieldNotFoundProblem(ExecutionContext context, ExecutionStrategyParameters parameters, GraphQLObjectType parentType) {
        FieldNotFoundError error = new FieldNotFoundError(parameters.getPath(), parameters.getField().get(0), parentType.getName());
        log.warn(error.getMessage());
        context.addError(error);
    }

    private void handleArgumentCoercionProblem(ExecutionContext context, ExecutionStrategyParameters parameters, CoercionException e) {
        ArgumentCoercionError error = new ArgumentCoercionError(parameters.getPath(), parameters.getField().get(0), e);
        log.warn(error.getMessage());
        context.addError(error);
    }

    /**
     * We treat Optional objects as "boxed" values where an empty Optional
     * equals a null object and a present Optional is the underlying value.
     *
     * @param result the incoming value
     *
     * @return an un-boxed result
     */
    protected Object unboxPossibleOptional(Object result) {
        if (result instanceof Optional) {
            Optional<?> optional = (Optional<?>) result;
            return optional.orElse(null);
        } else if (result instanceof OptionalInt) {
            OptionalInt optional = (OptionalInt) result;
            if (optional.isPresent()) {
                return optional.getAsInt();
            } else {
                return null;
            }
        } else if (result instanceof OptionalDouble) {
            OptionalDouble optional = (OptionalDouble) result;
            if (optional.isPresent()) {
                return optional.getAsDouble();
            } else {
                return null;
            }
        } else if (result instanceof OptionalLong) {
            OptionalLong optional = (OptionalLong) result;
            if (optional.isPresent()) {
                return optional.getAsLong();
            } else {
                return null;
            }
        }

        return result;
    }

    /**
     * Converts a value in a list position into a list of its elements. Iterables and arrays are accepted, anything
     * else is recorded as a {@link TypeMismatchError}.
     *
     * @param context    contains the top level execution parameters
     * @param parameters contains the parameters holding the fields to be executed and source object
     * @param result     the result object
     *
     * @return the elements, or null if the value can't be treated as a list
     */
    @SuppressWarnings("unchecked")
    protected List<Object> toList(ExecutionContext context, ExecutionStrategyParameters parameters, Object result) {
        if (result instanceof Collection) {
            return new ArrayList<>((Collection<Object>) result);
        }
        if (result instanceof Iterable) {
            List<Object> values = new ArrayList<>();
            for (Object value : (Iterable<Object>) result) {
                values.add(value);
            }
            return values;
        }
        if (result.getClass().isArray()) {
            int length = Array.getLength(result);
            List<Object> values = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                values.add(Array.get(result, i));
            }
            return values;
        }

        handleTypeMismatchProblem(context, parameters, result);
        return null;
    }

    private void handleTypeMismatchProblem(ExecutionContext context, ExecutionStrategyParameters parameters, Object result) {
        TypeMismatchError error = new TypeMismatchError(parameters.getPath(), parameters.getExecutionStepInfo().getType(), result);
        log.warn("{} got {}", error.getMessage(), result.getClass());
        context.addError(error);
    }

    protected Mono<GraphQLObjectType> resolveType(ExecutionContext executionContext, ExecutionStrategyParameters parameters, GraphQLOutputType fieldType, Object result) {
        return resolveType.resolveType(executionContext,
                                       parameters.getField().get(0),
                                       result,
                                       parameters.getExecutionStepInfo().getArguments(),
                                       fieldType);
    }

    /**
     * Called to discover the field definition give the current parameters and the AST {@link Field}
     *
     * @param schema     the schema in play
     * @param parentType the parent type of the field
     * @param field      the field to find the definition of
     *
     * @return a {@link GraphQLFieldDefinition}, or null when the parent type has no such field
     */
    protected GraphQLFieldDefinition getFieldDef(GraphQLSchema schema, GraphQLObjectType parentType, Field field) {
        return Introspection.getFieldDef(schema, parentType, field.getName());
    }

    protected GraphQLObjectType getParentType(ExecutionStrategyParameters parameters) {
        return (GraphQLObjectType) parameters.getExecutionStepInfo().getUnwrappedNonNullType();
    }

    /**
     * Builds the step info hierarchy for the current field
     *
     * @param parameters      contains the parameters holding the fields to be executed and source object
     * @param fieldDefinition the field definition to build type info for
     * @param argumentValues  the coerced arguments of the field, null when they could not be coerced
     *
     * @return a new step info
     */
    protected ExecutionStepInfo fieldStepInfo(ExecutionStrategyParameters parameters, GraphQLFieldDefinition fieldDefinition, Map<String, Object> argumentValues) {
        GraphQLOutputType fieldType = fieldDefinition.getType();
        Field field = null;
        if (parameters.getField() != null && !parameters.getField().isEmpty()) {
            field = parameters.getField().get(0);
        }
        return ExecutionStepInfo.newExecutionStepInfo()
                                .type(fieldType)
                                .fieldDefinition(fieldDefinition)
                                .field(field)
                                .path(parameters.getPath())
                                .parentInfo(parameters.getExecutionStepInfo())
                                .arguments(argumentValues)
                                .build();
    }

    protected static ExecutionResult nullResult() {
        return new ExecutionResultImpl(null, null);
    }
}
