package typegraph.execution.instrumentation;

import reactor.core.publisher.Mono;
import typegraph.PublicSpi;

/**
 * When a {@link Instrumentation}.'beginXXX()' method is called then it must return a non null InstrumentationContext
 * that will be invoked when the step is first dispatched and then when it completes.
 *
 * @param <T> the result type
 */
@PublicSpi
public interface InstrumentationContext<T> {

    /**
     * This is invoked when the instrumentation step is initially dispatched
     *
     * @param result the result of the step as a mono
     *
     * @return the (possibly decorated) result
     */
    Mono<T> onDispatched(Mono<T> result);

    /**
     * This is invoked when the instrumentation step is fully completed
     *
     * @param result the result of the step (which may be null)
     * @param t      this exception will be non null if an exception was thrown during the step
     */
    void onCompleted(T result, Throwable t);

    default Mono<T> instrument(Mono<T> mono) {
        return onDispatched(mono)
                .doOnSuccess(result -> onCompleted(result, null))
                .doOnError(t -> onCompleted(null, t));
    }
}
