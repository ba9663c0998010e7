package com.github.dimitryivaniuta.pagecache.cache.http;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CachedPageWriterTest {

    private final CachedPage page = new CachedPage(
            200,
            headers(),
            "text/plain",
            "hello".getBytes(StandardCharsets.UTF_8));

    @Test
    void shouldReplayStatusHeadersAndBody() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new CachedPageWriter(true).write(new MockHttpServletRequest("GET", "/"), response, page);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeaders("Vary")).containsExactly("Accept-Language", "Cookie");
        assertThat(response.getContentType()).startsWith("text/plain");
        assertThat(response.getHeader("X-Page-Cache")).isEqualTo("HIT");
        assertThat(response.getContentAsString()).isEqualTo("hello");
    }

    @Test
    void headShouldGetHeadersWithoutBody() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new CachedPageWriter(false).write(new MockHttpServletRequest("HEAD", "/"), response, page);

        assertThat(response.getContentLength()).isEqualTo(5);
        assertThat(response.getContentAsByteArray()).isEmpty();
        assertThat(response.containsHeader("X-Page-Cache")).isFalse();
    }

    @Test
    void copyShouldNotShareState() {
        CachedPage copy = page.copy();
        copy.headers().get("Vary").add("Accept-Encoding");
        copy.body()[0] = 'j';

        assertThat(page.headers().get("Vary")).containsExactly("Accept-Language", "Cookie");
        assertThat(new String(page.body(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(page.header("vary")).isEqualTo("Accept-Language");
    }

    @Test
    void snapshotShouldLeaveOutPerClientAndDerivedHeaders() throws Exception {
        PageCacheResponseWrapper response = new PageCacheResponseWrapper(new MockHttpServletResponse());
        response.setContentType("text/plain");
        response.addHeader("Set-Cookie", "JSESSIONID=abc");
        response.setHeader("X-Page-Cache", "MISS");
        response.setHeader("ETag", "\"v1\"");
        response.getOutputStream().write("hello".getBytes(StandardCharsets.UTF_8));

        CachedPage snapshot = response.snapshot();

        assertThat(snapshot.headers()).containsOnlyKeys("ETag");
        assertThat(snapshot.contentType()).startsWith("text/plain");
        assertThat(new String(snapshot.body(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    private static Map<String, List<String>> headers() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Vary", List.of("Accept-Language", "Cookie"));
        return headers;
    }
}
