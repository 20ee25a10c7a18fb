package com.webapp.backend_phishsense;

import com.webapp.backend_phishsense.repository.AnalysisJobRepo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
        "phishsense.analysis.max-text-length=20000",
        "phishsense.analysis.max-url-length=5000"
})
@AutoConfigureMockMvc
class LongInputAnalysisTests {
    @Autowired MockMvc mvc;
    @Autowired AnalysisJobRepo jobRepo;

    @Test
    void text_above_ten_thousand_chars_is_stored_when_limit_raised() throws Exception {
        long before = jobRepo.count();

        mvc.perform(post("/api/v1/analysis").param("text", "a".repeat(15000)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Safe"));

        assertThat(jobRepo.count()).isEqualTo(before + 1);
    }

    @Test
    void url_above_default_column_size_is_stored_when_limit_raised() throws Exception {
        mvc.perform(post("/api/v1/analysis").param("url", "https://example.com/" + "p".repeat(4000)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskScore").value(0));
    }

    @Test
    void text_above_raised_limit_is_rejected() throws Exception {
        mvc.perform(post("/api/v1/analysis").param("text", "a".repeat(20001)))
                .andExpect(status().isBadRequest());
    }
}
