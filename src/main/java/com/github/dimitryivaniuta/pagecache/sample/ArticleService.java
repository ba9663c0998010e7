package com.github.dimitryivaniuta.pagecache.sample;

import com.github.dimitryivaniuta.pagecache.sample.dto.ArticleView;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ArticleService {

    private static final Map<Long, Map<String, String>> TITLES = Map.of(
            1L, Map.of("en", "Caching pages", "fr", "Mettre des pages en cache"),
            2L, Map.of("en", "Vary explained", "fr", "Vary explique")
    );

    private final AtomicLong renders = new AtomicLong();

    /**
     * Renders an article; every call produces a fresh render token.
     */
    public ArticleView render(long id, Locale locale) {
        Map<String, String> titles = TITLES.get(id);
        if (titles == null) {
            throw new ArticleNotFoundException(id);
        }
        String language = titles.containsKey(locale.getLanguage()) ? locale.getLanguage() : "en";
        renders.incrementAndGet();
        return new ArticleView(id, language, titles.get(language), UUID.randomUUID().toString(), Instant.now());
    }

    public long renderCount() {
        return renders.get();
    }
}
