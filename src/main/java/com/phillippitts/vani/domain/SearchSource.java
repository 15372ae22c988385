package com.phillippitts.vani.domain;

/** Backend a search snippet came from. */
public enum SearchSource {
    WIKIPEDIA,
    WEB
}
