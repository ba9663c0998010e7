package com.github.dimitryivaniuta.pagecache.sample.dto;

import java.time.Instant;

/**
 * {@code renderToken} is new on every generation, so two responses carrying the same token
 * came from one cached page.
 */
public record ArticleView(
        long id,
        String language,
        String title,
        String renderToken,
        Instant generatedAt
) {}
