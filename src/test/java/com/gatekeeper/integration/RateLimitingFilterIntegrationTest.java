package com.gatekeeper.integration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
// endpoint quotas are shared by every client, so each class gets fresh state
@DirtiesContext
class RateLimitingFilterIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private static RequestPostProcessor from(String ip) {
        return request -> {
            request.setRemoteAddr(ip);
            return request;
        };
    }

    private static MockHttpServletRequestBuilder login(String ip) {
        return post("/api/auth/login").with(from(ip));
    }

    @Test
    void shouldRejectSixthLoginFromTheSameClient() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(login("203.0.113.10"))
                    .andExpect(status().is(not(429)))
                    .andExpect(header().exists("X-Request-Id"));
        }

        mockMvc.perform(login("203.0.113.10"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Rate limit exceeded (endpoint)"))
                .andExpect(jsonPath("$.status").value(429))
                .andExpect(header().exists("Retry-After"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void shouldShareWildcardQuotaAcrossClients() throws Exception {
        // the bulk wildcard admits one request per minute regardless of tier
        mockMvc.perform(get("/api/bulk/items").with(from("203.0.113.20")).header("X-User-Id", "bulk-user"))
                .andExpect(status().is(not(429)));

        mockMvc.perform(get("/api/bulk/items").with(from("203.0.113.21")).header("X-User-Id", "other-user"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void shouldNotLimitExcludedPaths() throws Exception {
        for (int i = 0; i < 120; i++) {
            mockMvc.perform(get("/actuator/health").with(from("203.0.113.30")))
                    .andExpect(status().is(not(429)));
        }
    }

    @Test
    void shouldExposeStorageHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.rateLimitStorage.details.backend").value("memory"));
    }
}
