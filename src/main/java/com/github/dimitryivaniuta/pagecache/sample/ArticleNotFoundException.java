package com.github.dimitryivaniuta.pagecache.sample;

public class ArticleNotFoundException extends RuntimeException {

    public ArticleNotFoundException(long id) {
        super("Article " + id + " not found");
    }
}
