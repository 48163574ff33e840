package com.bracketscan.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
