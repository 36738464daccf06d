package com.healthmonitor.api;

import com.healthmonitor.engine.metrics.MonitorMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "monitor.classifier.enabled=false")
class MonitorApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void actuatorHealth_shouldIncludeMonitorDetails() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.monitor.details.eventCapacity").value(1000));
    }

    @Test
    void monitorMeters_shouldBeBoundWithApplicationTag() {
        assertThat(meterRegistry.find(MonitorMetrics.EVENT_STORE_SIZE)
            .tag("application", "integration-health-monitor")
            .gauge()).isNotNull();
        assertThat(meterRegistry.find(MonitorMetrics.SYNC_INSTANCES)
            .tag("status", "failing")
            .gauge()).isNotNull();
    }
}
