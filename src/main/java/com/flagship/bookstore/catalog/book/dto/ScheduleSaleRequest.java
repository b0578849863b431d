package com.flagship.bookstore.catalog.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class ScheduleSaleRequest {

    @NotNull(message = "Percentage is required")
    @JsonProperty("percentage")
    BigDecimal percentage;

    @NotNull(message = "Start is required")
    @JsonProperty("start")
    Instant start;

    @NotNull(message = "End is required")
    @JsonProperty("end")
    Instant end;
}
