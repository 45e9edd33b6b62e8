package typegraph.execution.instrumentation;

import typegraph.PublicSpi;

/**
 * An {@link Instrumentation} implementation can create this as a stateful object that is then passed
 * to each instrumentation method, allowing state to be passed down with the request execution
 */
@PublicSpi
public interface InstrumentationState {
}
