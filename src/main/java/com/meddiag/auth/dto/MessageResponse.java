package com.meddiag.auth.dto;

public record MessageResponse(String message) {
}
