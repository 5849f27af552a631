package com.coderocket.model;

public record ConfigureResponse(boolean success, String message, String configPath) {
}
