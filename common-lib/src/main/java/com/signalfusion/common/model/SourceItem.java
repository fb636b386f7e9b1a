package com.signalfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw text item handed over by a news, forum or microblog fetcher.
 *
 * @param publishedAt timestamp string in any format {@code RecencyWeighter} accepts; may be null
 */
public record SourceItem(
    @JsonProperty("text") String text,
    @JsonProperty("source") String source,
    @JsonProperty("publishedAt") String publishedAt,
    @JsonProperty("kind") ItemKind kind
) {
    public SourceItem {
        text = text != null ? text : "";
        source = source != null ? source : "Unknown";
        kind = kind != null ? kind : ItemKind.ARTICLE;
    }

    public static SourceItem article(String text, String source, String publishedAt) {
        return new SourceItem(text, source, publishedAt, ItemKind.ARTICLE);
    }
}
