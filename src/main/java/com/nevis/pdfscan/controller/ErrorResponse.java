package com.nevis.pdfscan.controller;

public record ErrorResponse(
    String message,
    String errorCode,
    int status,
    long timestamp
) {}
