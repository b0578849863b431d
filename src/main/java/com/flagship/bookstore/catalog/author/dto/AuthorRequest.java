package com.flagship.bookstore.catalog.author.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.Map;

@Value
public class AuthorRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name cannot exceed 200 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("biographies")
    Map<String, String> biographies;

    public Map<String, String> biographiesOrEmpty() {
        return biographies == null ? Map.of() : biographies;
    }
}
