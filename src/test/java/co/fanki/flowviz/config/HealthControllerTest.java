package co.fanki.flowviz.config;

import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link HealthController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HealthControllerTest {

    @Test
    void whenGettingHealth_shouldReportStatusAndLimits() throws Exception {
        final MockMvc mockMvc = MockMvcBuilders
                .standaloneSetup(new HealthController(new FlowMdParser(50, 20)))
                .build();

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("up"))
                .andExpect(jsonPath("$.maxNodes").value(50))
                .andExpect(jsonPath("$.preferredMaxNodes").value(20));
    }
}
