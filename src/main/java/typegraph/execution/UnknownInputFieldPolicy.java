package typegraph.execution;

import typegraph.PublicApi;

/**
 * What to do with input object keys that the input object type doesn't declare
 */
@PublicApi
public enum UnknownInputFieldPolicy {
    /**
     * An undeclared key is a coercion failure
     */
    REJECT,
    /**
     * Undeclared keys are dropped silently
     */
    IGNORE
}
