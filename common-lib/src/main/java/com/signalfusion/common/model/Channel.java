package com.signalfusion.common.model;

public enum Channel {
    NEWS,
    SOCIAL_FORUM,
    MICROBLOG;

    public String code() {
        return name().toLowerCase();
    }
}
