package com.flagship.bookstore.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Conditional request handling shared by the controllers.
 *
 * - Reads: attach the ETag and answer a matching {@code If-None-Match} with 304
 * - Writes: turn {@code If-Match} into the expected stream version
 */
@Component
public class ConditionalRequestSupport {

    private final boolean requireIfMatch;

    public ConditionalRequestSupport(@Value("${bookstore.etag.require-if-match:false}") boolean requireIfMatch) {
        this.requireIfMatch = requireIfMatch;
    }

    /**
     * Expected version from an {@code If-Match} header.
     *
     * @return the version, or null when the write is unconditional (header absent or {@code *})
     * @throws PreconditionRequiredException if the header is absent and conditional writes are required
     * @throws IllegalArgumentException if the header is not a version tag
     */
    public Long expectedVersion(String ifMatch) {
        if (ifMatch == null || ifMatch.isBlank()) {
            if (requireIfMatch) {
                throw new PreconditionRequiredException("If-Match header with the current ETag is required");
            }
            return null;
        }
        if ("*".equals(ifMatch.trim())) {
            return null;
        }
        Long version = ETags.parse(ifMatch);
        if (version == null) {
            throw new IllegalArgumentException("Malformed If-Match header: " + ifMatch);
        }
        return version;
    }

    /**
     * 200 with body and ETag, or 304 without body if the client's tag is current.
     */
    public <T> ResponseEntity<T> conditionalGet(long version, String ifNoneMatch, Supplier<T> body) {
        return conditionalGet(version, 0, ifNoneMatch, body);
    }

    /**
     * Same as {@link #conditionalGet(long, String, Supplier)} for an entity served with its statistics;
     * the tag changes when either version does.
     */
    public <T> ResponseEntity<T> conditionalGet(long version, long statisticsVersion, String ifNoneMatch,
                                                Supplier<T> body) {
        String etag = ETags.generate(version, statisticsVersion);
        if (ETags.matches(ifNoneMatch, etag)) {
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
        }
        return ResponseEntity.ok().eTag(etag).body(body.get());
    }

    public HttpHeaders etagHeaders(long version) {
        HttpHeaders headers = new HttpHeaders();
        headers.setETag(ETags.generate(version));
        return headers;
    }
}
