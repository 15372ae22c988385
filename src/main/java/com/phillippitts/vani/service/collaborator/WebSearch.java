package com.phillippitts.vani.service.collaborator;

import java.util.List;

/**
 * Live web search.
 */
public interface WebSearch {

    /**
     * @return hits in rank order; empty when nothing matched
     * @throws com.phillippitts.vani.exception.CollaboratorTimeoutException if the engine does not answer in time
     */
    List<SearchSnippet> search(WebSearchRequest request);
}
