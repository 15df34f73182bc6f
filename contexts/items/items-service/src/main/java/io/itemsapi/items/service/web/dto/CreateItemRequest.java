package io.itemsapi.items.service.web.dto;

/**
 * Create request body. Unknown fields are ignored.
 *
 * @param name required, non-empty (checked by the store)
 * @param description optional
 */
public record CreateItemRequest(String name, String description) {}
