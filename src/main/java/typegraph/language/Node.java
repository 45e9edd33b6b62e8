package typegraph.language;

import typegraph.PublicApi;

/**
 * A node of a query document that has already been parsed and validated upstream.
 */
@PublicApi
public interface Node {

    /**
     * @return the position of this node in the query text, or null when the document was built in code
     */
    SourceLocation getSourceLocation();
}
