package com.phillippitts.vani.service.collaborator;

import java.util.Objects;

/**
 * One web search hit.
 *
 * @param title  page or article title; may be empty
 * @param text   short snippet
 * @param url    link to the page; may be empty
 * @param source publisher or engine name; may be empty
 */
public record SearchSnippet(String title, String text, String url, String source) {

    public SearchSnippet {
        Objects.requireNonNull(text, "text must not be null");
        title = title == null ? "" : title;
        url = url == null ? "" : url;
        source = source == null ? "" : source;
    }
}
