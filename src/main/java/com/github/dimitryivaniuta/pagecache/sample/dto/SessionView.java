package com.github.dimitryivaniuta.pagecache.sample.dto;

public record SessionView(
        String user,
        int visits,
        String renderToken
) {}
