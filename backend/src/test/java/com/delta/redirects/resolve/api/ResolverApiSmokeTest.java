package com.delta.redirects.resolve.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ResolverApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/resolve/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void statusReportsConnectivityAndCounts() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.counts.url_status").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.counts.redirects").value(greaterThanOrEqualTo(0)));
    }

    @Test
    void redirectsRejectThresholdAboveHundred() throws Exception {
        mockMvc.perform(get("/api/redirects").param("minPercent", "150"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_argument"));
    }

    @Test
    void redirectsListIsAnArray() throws Exception {
        mockMvc.perform(get("/api/redirects").param("minPercent", "99.5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/runs/987654321"))
            .andExpect(status().isNotFound());
    }

    @Test
    void deliveryWithoutCredentialsIsNotSent() throws Exception {
        mockMvc.perform(post("/api/redirects/deliver"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.delivered").value(false))
            .andExpect(jsonPath("$.error").value("delivery_not_configured"));
    }

    @Test
    void runWithMissingErrorSourceIsRecordedAsFailed() throws Exception {
        mockMvc.perform(post("/api/resolve/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"errorsFile\":\"/nonexistent/errors.json\",\"resetStore\":false,\"skipStatusCheck\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.notes").value("exception=SourceFileException"));
    }
}
