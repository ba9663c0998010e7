package com.github.dimitryivaniuta.pagecache.web;

import com.github.dimitryivaniuta.pagecache.cache.phase.CombinedCache;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Combined mode: one filter runs lookup, the rest of the chain on a miss, and the update.
 * Registered by {@code PageCacheConfig}, late in the chain so locale filters ran before it.
 */
@RequiredArgsConstructor
public class PageCacheFilter extends OncePerRequestFilter {

    private final CombinedCache cache;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        cache.execute(request, response, filterChain);
    }

    // the buffered body is released on the last async dispatch
    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }
}
