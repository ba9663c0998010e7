package com.github.dimitryivaniuta.pagecache.web;

import com.github.dimitryivaniuta.pagecache.cache.phase.UpdatePhase;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Two-phase mode, outermost half: sees the response after every inner filter added its
 * {@code Vary} headers, and stores it.
 */
@RequiredArgsConstructor
public class UpdateCacheFilter extends OncePerRequestFilter {

    private final UpdatePhase updatePhase;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        updatePhase.handle(request, response, filterChain);
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }
}
