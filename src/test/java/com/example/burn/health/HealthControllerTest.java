package com.example.burn.health;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.Mockito.when;

import com.example.burn.service.ExpirationScheduler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = HealthController.class)
@Import(HealthControllerTest.FixedClock.class)
class HealthControllerTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExpirationScheduler expirationScheduler;

    @Test
    @DisplayName("GET health reports status, environment and armed timers")
    void health() throws Exception {
        when(expirationScheduler.armedCount()).thenReturn(2);

        mockMvc.perform(MockMvcRequestBuilders.get("/health"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.status", equalTo("ok")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.env", equalTo("test")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.ts", equalTo("2025-03-01T12:00:00Z")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.armed_timers", equalTo(2)));
    }
}
