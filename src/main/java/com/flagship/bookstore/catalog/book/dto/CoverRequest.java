package com.flagship.bookstore.catalog.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CoverRequest {

    @NotBlank(message = "Cover image URL is required")
    @JsonProperty("cover_image_url")
    String coverImageUrl;
}
