package com.webapp.backend_phishsense;

import com.webapp.backend_phishsense.engine.RiskStatus;
import com.webapp.backend_phishsense.repository.AnalysisJobRepo;
import com.webapp.backend_phishsense.session.AnalysisSession;
import com.webapp.backend_phishsense.session.AnalysisSessionFactory;
import com.webapp.backend_phishsense.session.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "phishsense.analysis.simulated-delay=0ms")
@AutoConfigureMockMvc
class BackendPhishsenseApplicationTests {
    private static final Pattern JOB_ID = Pattern.compile("\"jobId\":\"([^\"]+)\"");

    @Autowired MockMvc mvc;
    @Autowired AnalysisJobRepo jobRepo;
    @Autowired AnalysisSessionFactory sessionFactory;

    @Test
    void analyze_then_fetch_in_simplified_mode() throws Exception {
        MvcResult created = mvc.perform(post("/api/v1/analysis")
                        .param("text", "Dear customer, urgent: verify your account and send your password")
                        .param("url", "http://bit.ly/xyz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Dangerous"))
                .andExpect(jsonPath("$.indicators.length()").value(5))
                .andExpect(jsonPath("$.riskScore").value(80))
                .andReturn();

        Matcher m = JOB_ID.matcher(created.getResponse().getContentAsString());
        assertThat(m.find()).isTrue();
        String jobId = m.group(1);
        assertThat(jobRepo.findByJobId(jobId)).isPresent();

        mvc.perform(get("/api/v1/analysis/" + jobId).param("mode", "simplified"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("simplified"))
                .andExpect(jsonPath("$.riskScore").value(80))
                .andExpect(jsonPath("$.nextSteps.length()").value(3));
    }

    @Test
    void blank_request_is_rejected() throws Exception {
        mvc.perform(post("/api/v1/analysis").param("text", "").param("url", ""))
                .andExpect(status().isBadRequest());
    }

    @Test
    void session_factory_uses_configured_delay() {
        AnalysisSession session = sessionFactory.create();
        session.updateForm("Hi Mom, just checking in", "");
        session.submit();
        assertThat(session.getState()).isEqualTo(SessionState.RESULT);
        assertThat(session.getResult().getStatus()).isEqualTo(RiskStatus.SAFE);
    }
}
