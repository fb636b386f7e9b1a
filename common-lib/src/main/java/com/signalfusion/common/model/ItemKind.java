package com.signalfusion.common.model;

/**
 * Shape of a raw item as delivered by a fetcher. Forum posts carry more weight than
 * the comments beneath them when a channel is aggregated.
 */
public enum ItemKind {
    ARTICLE,
    POST,
    COMMENT,
    MESSAGE
}
