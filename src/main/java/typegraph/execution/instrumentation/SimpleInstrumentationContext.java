package typegraph.execution.instrumentation;

import reactor.core.publisher.Mono;
import typegraph.PublicApi;

import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;

/**
 * An {@link InstrumentationContext} assembled from lambdas. Either hook may be absent, in which case the step's
 * mono passes through untouched or its outcome is ignored.
 *
 * @param <T> the type of value the instrumented step produces
 */
@PublicApi
public class SimpleInstrumentationContext<T> implements InstrumentationContext<T> {

    private static final SimpleInstrumentationContext<Object> NO_OP = new SimpleInstrumentationContext<>(null, null);

    private final UnaryOperator<Mono<T>> onDispatch;
    private final BiConsumer<T, Throwable> onComplete;

    private SimpleInstrumentationContext(UnaryOperator<Mono<T>> onDispatch, BiConsumer<T, Throwable> onComplete) {
        this.onDispatch = onDispatch;
        this.onComplete = onComplete;
    }

    /**
     * @param <U> the type of value the step produces
     *
     * @return the shared context that neither decorates nor observes the step
     */
    @SuppressWarnings("unchecked")
    public static <U> SimpleInstrumentationContext<U> noOp() {
        return (SimpleInstrumentationContext<U>) NO_OP;
    }

    @Override
    public Mono<T> onDispatched(Mono<T> result) {
        return onDispatch == null ? result : onDispatch.apply(result);
    }

    @Override
    public void onCompleted(T result, Throwable t) {
        if (onComplete != null) {
            onComplete.accept(result, t);
        }
    }

    /**
     * @param decorator applied to the step's mono when the step is dispatched, for example to add a timer or a
     *                  context entry
     * @param <U>       the type of value the step produces
     *
     * @return a context that only decorates the step
     */
    public static <U> SimpleInstrumentationContext<U> whenDispatched(UnaryOperator<Mono<U>> decorator) {
        return new SimpleInstrumentationContext<>(decorator, null);
    }

    /**
     * @param listener told the value of the step, or the error it failed with
     * @param <U>      the type of value the step produces
     *
     * @return a context that only observes the outcome of the step
     */
    public static <U> SimpleInstrumentationContext<U> whenCompleted(BiConsumer<U, Throwable> listener) {
        return new SimpleInstrumentationContext<>(null, listener);
    }

    /**
     * @param decorator applied to the step's mono when the step is dispatched
     * @param listener  told the value of the step, or the error it failed with
     * @param <U>       the type of value the step produces
     *
     * @return a context that decorates the step and observes its outcome
     */
    public static <U> SimpleInstrumentationContext<U> of(UnaryOperator<Mono<U>> decorator, BiConsumer<U, Throwable> listener) {
        return new SimpleInstrumentationContext<>(decorator, listener);
    }
}
