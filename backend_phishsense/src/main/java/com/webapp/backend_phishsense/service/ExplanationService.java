package com.webapp.backend_phishsense.service;

import com.webapp.backend_phishsense.dtos.NextStepDto;
import com.webapp.backend_phishsense.engine.AnalysisResult;
import com.webapp.backend_phishsense.engine.RiskStatus;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ExplanationService {
    static final String NO_INDICATORS = "No common patterns found";

    private static final List<String> SAFE_NORMAL = List.of(
            "This message appears to be legitimate based on standard communication patterns. "
                    + "No known phishing signatures or suspicious links were identified in the content provided."
    );
    private static final List<String> SAFE_SIMPLIFIED = List.of(
            "This looks like a normal message from a friend or a real company. "
                    + "It doesn't have any of the 'sneaky tricks' that bad people use to steal things."
    );
    private static final String RISKY_NORMAL_LEAD =
            "Our analysis has identified several high-risk elements in this communication. "
                    + "The message uses manipulative language designed to trigger an emotional response.";
    private static final String RISKY_NORMAL_CONCERN =
            "The primary concern is the %s. This is a classic tactic used by attackers to bypass "
                    + "logical thinking and force a quick mistake.";
    private static final List<String> RISKY_SIMPLIFIED = List.of(
            "Imagine someone wearing a mask pretending to be your principal. "
                    + "They are shouting 'Hurry up!' so you don't look closely at their mask.",
            "They want you to click a button or give them a secret password. "
                    + "But remember: real companies will never yell at you to do something right this second."
    );

    private static final List<NextStepDto> SAFE_STEPS = List.of(
            step("Looks safe", "You can proceed, but always be cautious if they ask for payment or passwords.")
    );
    private static final List<NextStepDto> RISKY_STEPS = List.of(
            step("Do NOT click any links",
                    "Hover your mouse over links to see where they really go without clicking."),
            step("Visit the official website directly",
                    "Open a new tab and type the website address yourself instead of clicking the link."),
            step("Report this message",
                    "Mark it as 'Spam' or 'Phishing' in your email app to help others.")
    );

    public List<String> explain(AnalysisResult result, ExplanationMode mode) {
        boolean safe = result.getStatus() == RiskStatus.SAFE;
        if (mode == ExplanationMode.SIMPLIFIED) {
            return safe ? SAFE_SIMPLIFIED : RISKY_SIMPLIFIED;
        }
        if (safe) {
            return SAFE_NORMAL;
        }
        return List.of(RISKY_NORMAL_LEAD,
                String.format(RISKY_NORMAL_CONCERN, String.join(" and ", result.getIndicators())));
    }

    public List<NextStepDto> nextSteps(RiskStatus status) {
        return status == RiskStatus.SAFE ? SAFE_STEPS : RISKY_STEPS;
    }

    public String indicatorHeadline(List<String> indicators) {
        if (indicators.isEmpty()) {
            return NO_INDICATORS;
        }
        return indicators.size() == 1 ? "1 indicator detected" : indicators.size() + " indicators detected";
    }

    private static NextStepDto step(String title, String detail) {
        return NextStepDto.builder().title(title).detail(detail).build();
    }
}
