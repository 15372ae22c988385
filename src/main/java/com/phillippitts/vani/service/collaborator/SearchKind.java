package com.phillippitts.vani.service.collaborator;

/** Flavour of a web search: recent news articles or general pages. */
public enum SearchKind {
    NEWS,
    GENERAL
}
