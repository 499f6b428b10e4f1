package com.hirepanel.core.model;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
