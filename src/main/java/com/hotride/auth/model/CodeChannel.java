package com.hotride.auth.model;

public enum CodeChannel {
    EMAIL,
    PHONE
}
