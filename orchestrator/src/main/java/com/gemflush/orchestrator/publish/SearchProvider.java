package com.gemflush.orchestrator.publish;

import java.util.List;

/** External web search capability used to find notability references. */
public interface SearchProvider {

    List<SearchResult> search(String query);
}
