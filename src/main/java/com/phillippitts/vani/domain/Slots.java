package com.phillippitts.vani.domain;

/** Slot names shared by the rule table, the extractor and the dispatcher. */
public final class Slots {

    public static final String APP = "app";
    public static final String SITE = "site";
    public static final String BROWSER = "browser";
    public static final String DIRECTION = "direction";
    public static final String QUERY = "query";
    /** Optional search flavour: "news" or "general". */
    public static final String SEARCH_KIND = "kind";

    private Slots() {
    }
}
