package dev.catananti.cms.dto;

public record MessageResponse(String message) {
}
