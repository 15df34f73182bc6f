package io.itemsapi.items.service.web.dto;

/** Plain confirmation body: {@code {"message": "..."}}. */
public record MessageResponse(String message) {}
