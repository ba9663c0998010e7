package com.github.dimitryivaniuta.pagecache.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.pagecache.sample.ArticleService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PageCacheEndpointsTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired CacheManager cacheManager;
    @Autowired MeterRegistry meterRegistry;
    @Autowired ArticleService articleService;

    @BeforeEach
    void clearPages() {
        cacheManager.getCache("pages:ttl=60").clear();
    }

    @Test
    void article_shouldBeServedFromCacheOnSecondCall() throws Exception {
        long rendersBefore = articleService.renderCount();

        MvcResult first = mvc.perform(get("/api/articles/{id}", 1).header("Accept-Language", "en"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Page-Cache", "MISS"))
                .andExpect(header().string("Cache-Control", containsString("max-age=60")))
                .andExpect(header().exists("ETag"))
                .andExpect(header().exists("Expires"))
                .andReturn();

        MvcResult second = mvc.perform(get("/api/articles/{id}", 1).header("Accept-Language", "en"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Page-Cache", "HIT"))
                .andExpect(header().string("Vary", containsString("Accept-Language")))
                .andExpect(jsonPath("$.title").value("Caching pages"))
                .andReturn();

        assertThat(token(second)).isEqualTo(token(first));
        assertThat(articleService.renderCount()).isEqualTo(rendersBefore + 1);
        assertThat(second.getResponse().getHeader("ETag")).isEqualTo(first.getResponse().getHeader("ETag"));
        assertThat(meterRegistry.counter("pagecache_lookups_total", "backend", "pages:ttl=60", "outcome", "hit").count())
                .isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void article_shouldBeCachedPerLanguage() throws Exception {
        String en = token(mvc.perform(get("/api/articles/{id}", 2).header("Accept-Language", "en")).andReturn());
        MvcResult fr = mvc.perform(get("/api/articles/{id}", 2).header("Accept-Language", "fr"))
                .andExpect(header().string("X-Page-Cache", "MISS"))
                .andExpect(jsonPath("$.language").value("fr"))
                .andReturn();
        String enAgain = token(mvc.perform(get("/api/articles/{id}", 2).header("Accept-Language", "en"))
                .andExpect(header().string("X-Page-Cache", "HIT"))
                .andReturn());

        assertThat(token(fr)).isNotEqualTo(en);
        assertThat(enAgain).isEqualTo(en);
    }

    @Test
    void liveArticle_shouldNeverBeCached() throws Exception {
        String t1 = token(mvc.perform(get("/api/articles/{id}/live", 1)).andExpect(status().isOk()).andReturn());
        String t2 = token(mvc.perform(get("/api/articles/{id}/live", 1))
                .andExpect(header().string("X-Page-Cache", "MISS"))
                .andReturn());

        assertThat(t2).isNotEqualTo(t1);
    }

    @Test
    void unknownArticle_shouldNotBeCached() throws Exception {
        mvc.perform(get("/api/articles/{id}", 99))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
        mvc.perform(get("/api/articles/{id}", 99))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Page-Cache", "MISS"));
    }

    @Test
    void post_shouldBypassTheCache() throws Exception {
        mvc.perform(get("/api/articles/{id}", 1)).andExpect(status().isOk());

        mvc.perform(post("/api/articles/{id}", 1))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Page-Cache"));
    }

    @Test
    void head_shouldReuseTheGetPage() throws Exception {
        mvc.perform(get("/api/articles/{id}", 1)).andExpect(status().isOk());

        MvcResult head = mvc.perform(head("/api/articles/{id}", 1))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Page-Cache", "HIT"))
                .andReturn();

        assertThat(head.getResponse().getContentAsByteArray()).isEmpty();
    }

    private String token(MvcResult result) throws Exception {
        JsonNode json = om.readTree(result.getResponse().getContentAsString());
        return json.get("renderToken").asText();
    }
}
