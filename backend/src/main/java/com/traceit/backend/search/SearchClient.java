package com.traceit.backend.search;

import java.util.List;

/**
 * Web search used to gather evidence for origin tracing
 */
public interface SearchClient {

    List<SearchHit> search(String query);
}
