package typegraph.language;

import typegraph.PublicApi;

/**
 * A literal (or variable reference) appearing as an argument value in a query document
 */
@PublicApi
public interface Value extends Node {

    @Override
    default SourceLocation getSourceLocation() {
        return null;
    }
}
