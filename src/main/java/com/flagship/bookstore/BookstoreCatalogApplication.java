package com.flagship.bookstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookstoreCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookstoreCatalogApplication.class, args);
    }
}
