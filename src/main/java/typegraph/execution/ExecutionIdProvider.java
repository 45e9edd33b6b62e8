package typegraph.execution;

import typegraph.PublicSpi;
import typegraph.language.Document;

/**
 * A provider of {@link ExecutionId}s
 */
@PublicSpi
public interface ExecutionIdProvider {

    ExecutionIdProvider DEFAULT_EXECUTION_ID_PROVIDER = (document, operationName, context) -> ExecutionId.generate();

    /**
     * Allows provision of a unique identifier per query execution.
     *
     * @param document      the query document to be executed
     * @param operationName the name of the operation to execute, may be null
     * @param context       the context object passed to the execution
     *
     * @return a non null {@link ExecutionId}
     */
    ExecutionId provide(Document document, String operationName, Object context);
}
