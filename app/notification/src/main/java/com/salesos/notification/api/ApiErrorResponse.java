package com.salesos.notification.api;

public record ApiErrorResponse(String code, String message) {}
