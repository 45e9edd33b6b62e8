package typegraph.language;

import typegraph.PublicApi;

@PublicApi
public interface Definition extends Node {
}
