package com.flagship.bookstore.catalog;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Getter
public class CacheSettings {

    private final Duration itemTtl;
    private final Duration listTtl;

    public CacheSettings(@Value("${bookstore.cache.item-ttl:PT10M}") Duration itemTtl,
                         @Value("${bookstore.cache.list-ttl:PT2M}") Duration listTtl) {
        this.itemTtl = itemTtl;
        this.listTtl = listTtl;
    }
}
