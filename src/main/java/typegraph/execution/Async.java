package typegraph.execution;

import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.concurrent.Queues;
import typegraph.Internal;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;

@Internal
public class Async {

    /**
     * Subscribes to the mono of every element at once and emits their values in the order of the elements. A
     * failing element does not cancel the others: the error is delivered once all of them have finished, and if
     * several failed the first one recorded is delivered.
     *
     * @param list      the elements, which may contain nulls
     * @param cfFactory creates the mono of an element given its index
     * @param <T>       the element type
     * @param <U>       the result type
     *
     * @return the values in element order
     */
    public static <T, U> Flux<U> each(List<T> list, BiFunction<Integer, T, Mono<U>> cfFactory) {
        return Flux.range(0, list.size())
                   .map(index -> cfFactory.apply(index, list.get(index)))
                   .flatMapSequentialDelayError(Function.identity(), Queues.SMALL_BUFFER_SIZE, Queues.XS_BUFFER_SIZE)
                   .onErrorMap(Exceptions::isMultiple, Async::firstError);
    }

    /**
     * Like {@link #each(List, BiFunction)} but the mono of an element is only subscribed to once the previous
     * one has completed, and the first error stops the iteration.
     *
     * @param list      the elements
     * @param cfFactory creates the mono of an element given its index
     * @param <T>       the element type
     * @param <U>       the result type
     *
     * @return the values in element order
     */
    public static <T, U> Flux<U> eachSequentially(List<T> list, BiFunction<Integer, T, Mono<U>> cfFactory) {
        return Flux.range(0, list.size())
                   .map(index -> cfFactory.apply(index, list.get(index)))
                   .concatMap(Function.identity());
    }

    /**
     * Turns an object T into a Mono if its not already
     *
     * @param t   - the object to check
     * @param <T> for two
     *
     * @return a Mono, empty when t is null
     */
    public static <T> Mono<T> toMono(T t) {
        if (t instanceof Mono) {
            //noinspection unchecked
            return ((Mono<T>) t);
        }
        if (t instanceof CompletionStage) {
            //noinspection unchecked
            return Mono.fromCompletionStage((CompletionStage<T>) t);
        } else {
            return Mono.justOrEmpty(t);
        }
    }

    private static Throwable firstError(Throwable multiple) {
        List<Throwable> errors = Exceptions.unwrapMultiple(multiple);
        return errors.isEmpty() ? multiple : errors.get(0);
    }
}
