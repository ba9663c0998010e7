package com.github.dimitryivaniuta.pagecache.sample;

import com.github.dimitryivaniuta.pagecache.sample.dto.ArticleView;
import com.github.dimitryivaniuta.pagecache.sample.dto.SessionView;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Callable;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class ArticleController {

    private final ArticleService articleService;

    @GetMapping("/articles/{id}")
    public ResponseEntity<ArticleView> article(@PathVariable long id, Locale locale) {
        return ResponseEntity.ok()
                .header(HttpHeaders.VARY, HttpHeaders.ACCEPT_LANGUAGE)
                .body(articleService.render(id, locale));
    }

    /** Explicitly uncacheable. */
    @GetMapping("/articles/{id}/live")
    public ResponseEntity<ArticleView> live(@PathVariable long id, Locale locale) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(Duration.ZERO))
                .body(articleService.render(id, locale));
    }

    /** Rendered on an async thread. */
    @GetMapping("/articles/{id}/async")
    public Callable<ArticleView> async(@PathVariable long id, Locale locale) {
        return () -> articleService.render(id, locale);
    }

    @PostMapping("/articles/{id}")
    public ArticleView refresh(@PathVariable long id, Locale locale) {
        return articleService.render(id, locale);
    }

    /** Uses the session, so the page is per-user once the caller is authenticated. */
    @GetMapping("/me")
    public SessionView me(HttpServletRequest request) {
        HttpSession session = request.getSession();
        Integer visits = (Integer) session.getAttribute("visits");
        int next = visits == null ? 1 : visits + 1;
        session.setAttribute("visits", next);
        String user = request.getUserPrincipal() != null ? request.getUserPrincipal().getName() : "anonymous";
        return new SessionView(user, next, UUID.randomUUID().toString());
    }
}
