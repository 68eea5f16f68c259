package com.swipesentinel.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of interactive affordance the extractor recognises. */
public enum TargetKind {
    LIKE_BUTTON,
    PASS_BUTTON,
    SEND_LIKE,
    COMMENT_INPUT,
    CLOSE_OVERLAY,
    MESSAGE_INPUT,
    SEND_BUTTON,
    THREAD_ROW,
    TAB_DISCOVER,
    TAB_MATCHES,
    TAB_LIKES_YOU,
    TAB_STANDOUTS,
    TAB_PROFILE_HUB;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
