package typegraph.schema;

import typegraph.PublicSpi;

/**
 * A resolver: it produces the raw value of a field from its parent value, its coerced arguments and the
 * execution context, all handed over in the {@link DataFetchingEnvironment}.
 * <p>
 * The raw value may be a plain value, an {@link java.util.Optional}, a {@link reactor.core.publisher.Mono}, a
 * {@link java.util.concurrent.CompletionStage} or a {@link typegraph.execution.DataFetcherResult}. Throwing (or
 * a failed Mono/CompletionStage) turns into an error scoped to this field.
 *
 * @param <T> the type of object returned
 */
@PublicSpi
@FunctionalInterface
public interface DataFetcher<T> {

    T get(DataFetchingEnvironment environment) throws Exception;
}
