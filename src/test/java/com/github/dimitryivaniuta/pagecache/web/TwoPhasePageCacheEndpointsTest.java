package com.github.dimitryivaniuta.pagecache.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.pagecache.cache.phase.CombinedCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "page-cache.mode=two-phase",
                "page-cache.anonymous-only=true"
        })
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TwoPhasePageCacheEndpointsTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired CacheManager cacheManager;
    @Autowired ApplicationContext context;

    @BeforeEach
    void clearPages() {
        cacheManager.getCache("pages:ttl=60").clear();
    }

    @Test
    void shouldRegisterSeparateFetchAndUpdateFilters() {
        assertThat(context.getBeanNamesForType(CombinedCache.class)).isEmpty();
        assertThat(context.containsBean("updateCacheFilter")).isTrue();
        assertThat(context.containsBean("fetchFromCacheFilter")).isTrue();
    }

    @Test
    void article_shouldBeServedFromCacheOnSecondCall() throws Exception {
        String t1 = token(mvc.perform(get("/api/articles/{id}", 1))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Page-Cache", "MISS"))
                .andReturn());
        String t2 = token(mvc.perform(get("/api/articles/{id}", 1))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Page-Cache", "HIT"))
                .andReturn());

        assertThat(t2).isEqualTo(t1);
    }

    @Test
    void authenticatedSessionPage_shouldNotBeCached() throws Exception {
        String t1 = token(mvc.perform(get("/api/me").principal(() -> "alice"))
                .andExpect(jsonPath("$.user").value("alice"))
                .andReturn());
        String t2 = token(mvc.perform(get("/api/me").principal(() -> "alice"))
                .andExpect(header().string("X-Page-Cache", "MISS"))
                .andReturn());

        assertThat(t2).isNotEqualTo(t1);
    }

    @Test
    void anonymousSessionPage_shouldBeCached() throws Exception {
        String t1 = token(mvc.perform(get("/api/me")).andExpect(status().isOk()).andReturn());
        String t2 = token(mvc.perform(get("/api/me"))
                .andExpect(header().string("X-Page-Cache", "HIT"))
                .andReturn());

        assertThat(t2).isEqualTo(t1);
    }

    private String token(MvcResult result) throws Exception {
        return om.readTree(result.getResponse().getContentAsString()).get("renderToken").asText();
    }
}
