package com.flagship.bookstore.catalog.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request body for tenants. {@code enabled} is ignored on creation; new tenants start enabled.
 */
@Value
public class TenantRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name cannot exceed 100 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("enabled")
    Boolean enabled;
}
