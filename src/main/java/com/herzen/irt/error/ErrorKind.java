package com.herzen.irt.error;

public enum ErrorKind {
    SCHEMA,
    INSUFFICIENT_DATA,
    ESTIMATION,
    CURVE_COMPUTATION,
    INVALID_REQUEST,
    SESSION_NOT_FOUND
}
