package com.traceradar.domain;

public enum MessageType {
    INTERNAL,
    EXTERNAL_IN,
    EXTERNAL_OUT
}
