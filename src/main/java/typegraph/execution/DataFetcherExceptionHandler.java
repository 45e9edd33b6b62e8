package typegraph.execution;

import typegraph.PublicSpi;

/**
 * This is called when an exception is thrown during {@link typegraph.schema.DataFetcher#get(typegraph.schema.DataFetchingEnvironment)} execution
 */
@PublicSpi
public interface DataFetcherExceptionHandler {

    /**
     * When an exception during a call to a {@link typegraph.schema.DataFetcher} then this handler
     * is called back to shape the error that should be placed in the list of errors
     *
     * @param handlerParameters the parameters to this callback
     */
    void accept(DataFetcherExceptionHandlerParameters handlerParameters);
}
