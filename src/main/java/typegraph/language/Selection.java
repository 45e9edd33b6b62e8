package typegraph.language;

import typegraph.PublicApi;

import java.util.List;

/**
 * One entry of a {@link SelectionSet}: a {@link Field}, an {@link InlineFragment} or a {@link FragmentSpread}
 */
@PublicApi
public interface Selection extends Node {

    List<Directive> getDirectives();
}
