package com.sds.phucth.sessioncontext.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sds.phucth.sessioncontext.config.JacksonConfig;
import com.sds.phucth.sessioncontext.controllers.ContextController;
import com.sds.phucth.sessioncontext.controllers.HealthController;
import com.sds.phucth.sessioncontext.exceptions.GlobalExceptionHandler;
import com.sds.phucth.sessioncontext.services.ApprovalOrchestrator;
import com.sds.phucth.sessioncontext.services.CachedContextStore;
import com.sds.phucth.sessioncontext.services.ContextService;
import java.time.Clock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ApiTokenFilterTest {

    private final ApiTokenFilter filter = new ApiTokenFilter("s3cret-token", new JacksonConfig().objectMapper());

    private MockHttpServletRequest request(String uri, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.setRequestURI(uri);
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    @DisplayName("Valid bearer token passes through")
    void validToken() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/api/context/s1", "Bearer s3cret-token"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Missing header is rejected with 401 before the chain runs")
    void missingHeader() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/api/context/s1", null), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString())
                .contains("\"code\":\"UNAUTHORIZED\"")
                .contains("Missing or invalid Authorization header");
    }

    @Test
    @DisplayName("Wrong token is rejected with 401")
    void wrongToken() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/api/actions/s1", "Bearer guess"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("Unconfigured token refuses every API call")
    void unconfiguredFailsClosed() throws Exception {
        ApiTokenFilter open = new ApiTokenFilter("", new JacksonConfig().objectMapper());
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        open.doFilter(request("/api/context/s1", "Bearer "), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("Health check without a token is rejected before any storage tier is pinged")
    void healthRequiresToken() throws Exception {
        ContextService contextService = mock(ContextService.class);
        CachedContextStore cachedContextStore = mock(CachedContextStore.class);
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(
                        contextService, cachedContextStore, mock(ApprovalOrchestrator.class), Clock.systemUTC()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(filter)
                .build();

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isUnauthorized());

        verify(contextService, never()).storeAvailable();
        verify(cachedContextStore, never()).cacheAvailable();
    }

    @Test
    @DisplayName("Paths outside the API are not filtered")
    void nonApiPathUnfiltered() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/favicon.ico", null), response, chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    @DisplayName("Rejected requests never reach a controller")
    void rejectedNeverReachesController() throws Exception {
        ContextService contextService = mock(ContextService.class);
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new ContextController(contextService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(filter)
                .build();

        mockMvc.perform(get("/api/context/s1").header("Authorization", "Bearer nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

        verify(contextService, never()).read(anyString());
    }
}
