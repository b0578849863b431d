package com.flagship.bookstore.domain.book;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A scheduled percentage discount. Sales are identified by their start instant.
 */
@Value
public class BookSale {
    BigDecimal percentage;
    Instant start;
    Instant end;

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return otherStart.isBefore(end) && otherEnd.isAfter(start);
    }

    public boolean isActiveAt(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
