package com.flagship.bookstore.catalog.category.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.Map;

/**
 * Category names keyed by culture, e.g. {@code {"en": "Fantasy", "de": "Fantasy"}}.
 */
@Value
public class CategoryRequest {

    @NotEmpty(message = "At least one name is required")
    @JsonProperty("names")
    Map<String, String> names;
}
