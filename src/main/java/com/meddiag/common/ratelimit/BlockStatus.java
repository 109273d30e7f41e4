package com.meddiag.common.ratelimit;

public record BlockStatus(boolean blocked, long secondsRemaining) {

    public static final BlockStatus NOT_BLOCKED = new BlockStatus(false, 0);
}
