package com.starscape.contacts.features.auth.api.dto;

public record MessageResponse(String message) {}
