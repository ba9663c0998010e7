package com.github.dimitryivaniuta.pagecache.cache.http;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FreshnessHeadersTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private static final byte[] BODY = "hello".getBytes(StandardCharsets.UTF_8);

    @Test
    void shouldStampAllFreshnessHeaders() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        FreshnessHeaders.patch(response, BODY, 60, NOW, true);

        assertThat(response.getHeader("ETag")).isEqualTo("\"" + DigestUtils.md5DigestAsHex(BODY) + "\"");
        assertThat(response.getHeader("Last-Modified")).isEqualTo("Mon, 05 Jan 2026 10:00:00 GMT");
        assertThat(response.getHeader("Expires")).isEqualTo("Mon, 05 Jan 2026 10:01:00 GMT");
        assertThat(response.getHeader("Cache-Control")).isEqualTo("max-age=60");
    }

    @Test
    void patchingTwiceShouldEqualPatchingOnce() {
        MockHttpServletResponse once = new MockHttpServletResponse();
        MockHttpServletResponse twice = new MockHttpServletResponse();

        FreshnessHeaders.patch(once, BODY, 60, NOW, true);
        FreshnessHeaders.patch(twice, BODY, 60, NOW, true);
        FreshnessHeaders.patch(twice, BODY, 60, NOW.plusSeconds(5), true);

        for (String name : once.getHeaderNames()) {
            assertThat(twice.getHeaders(name)).as(name).isEqualTo(once.getHeaders(name));
        }
        assertThat(twice.getHeaderNames()).containsExactlyInAnyOrderElementsOf(once.getHeaderNames());
    }

    @Test
    void shouldKeepHeadersTheHandlerSet() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        response.setHeader("ETag", "\"v1\"");
        response.setHeader("Cache-Control", "public, max-age=30");

        FreshnessHeaders.patch(response, BODY, 60, NOW, true);

        assertThat(response.getHeader("ETag")).isEqualTo("\"v1\"");
        assertThat(response.getHeader("Cache-Control")).isEqualTo("public, max-age=30");
    }

    @Test
    void shouldSkipEtagWhenDisabled() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        FreshnessHeaders.patch(response, BODY, 0, NOW, false);

        assertThat(response.containsHeader("ETag")).isFalse();
        assertThat(response.getHeader("Expires")).isEqualTo(response.getHeader("Last-Modified"));
        assertThat(response.getHeader("Cache-Control")).isEqualTo("max-age=0");
    }
}
