package com.github.dimitryivaniuta.pagecache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PageCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PageCacheApplication.class, args);
    }
}
