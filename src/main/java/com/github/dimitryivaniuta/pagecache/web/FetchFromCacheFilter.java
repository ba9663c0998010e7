package com.github.dimitryivaniuta.pagecache.web;

import com.github.dimitryivaniuta.pagecache.cache.http.CachedPage;
import com.github.dimitryivaniuta.pagecache.cache.http.CachedPageWriter;
import com.github.dimitryivaniuta.pagecache.cache.phase.FetchPhase;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Two-phase mode, innermost half: answers from the cache, or lets the handler generate the page.
 * Runs on the initial dispatch only.
 */
@RequiredArgsConstructor
public class FetchFromCacheFilter extends OncePerRequestFilter {

    private final FetchPhase fetchPhase;
    private final CachedPageWriter writer;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<CachedPage> cached = fetchPhase.lookup(request);
        if (cached.isPresent()) {
            writer.write(request, response, cached.get());
            return;
        }
        filterChain.doFilter(request, response);
    }
}
