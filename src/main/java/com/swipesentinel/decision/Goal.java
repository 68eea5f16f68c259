package com.swipesentinel.decision;

/** What the deterministic policy optimises for during a run. */
public enum Goal {
    SWIPE,
    MESSAGE,
    EXPLORE
}
