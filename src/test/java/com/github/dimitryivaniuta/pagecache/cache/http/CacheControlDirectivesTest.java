package com.github.dimitryivaniuta.pagecache.cache.http;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheControlDirectivesTest {

    @Test
    void shouldParseDirectivesAcrossHeaderValues() {
        CacheControlDirectives cc = CacheControlDirectives.parse(List.of("Public, max-age=60", "no-cache"));

        assertThat(cc.has("public")).isTrue();
        assertThat(cc.has("NO-CACHE")).isTrue();
        assertThat(cc.maxAge()).hasValue(60);
        assertThat(cc.format()).isEqualTo("public, max-age=60, no-cache");
    }

    @Test
    void malformedMaxAgeShouldCountAsAbsent() {
        assertThat(CacheControlDirectives.parse(List.of("max-age=soon")).maxAge()).isEmpty();
        assertThat(CacheControlDirectives.parse(List.of("max-age=-5")).maxAge()).isEmpty();
        assertThat(CacheControlDirectives.parse(List.of("max-age")).maxAge()).isEmpty();
        assertThat(CacheControlDirectives.parse(List.of("max-age=\"30\"")).maxAge()).hasValue(30);
    }

    @Test
    void withMaxAgeShouldOnlyShrink() {
        CacheControlDirectives cc = CacheControlDirectives.parse(List.of("public, max-age=60"));

        assertThat(cc.withMaxAge(120).format()).isEqualTo("public, max-age=60");
        assertThat(cc.withMaxAge(30).format()).isEqualTo("public, max-age=30");
        assertThat(CacheControlDirectives.parse(List.of()).withMaxAge(90).format()).isEqualTo("max-age=90");
    }

    @Test
    void noStoreAndPrivateShouldForbidStorage() {
        assertThat(CacheControlDirectives.parse(List.of("no-store")).forbidsStorage()).isTrue();
        assertThat(CacheControlDirectives.parse(List.of("private, max-age=60")).forbidsStorage()).isTrue();
        assertThat(CacheControlDirectives.parse(List.of("no-cache")).forbidsStorage()).isFalse();
        assertThat(CacheControlDirectives.parse(null).forbidsStorage()).isFalse();
    }
}
