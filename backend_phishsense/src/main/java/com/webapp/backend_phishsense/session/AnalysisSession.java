package com.webapp.backend_phishsense.session;

import com.webapp.backend_phishsense.engine.AnalysisResult;
import com.webapp.backend_phishsense.engine.RiskScoringEngine;
import com.webapp.backend_phishsense.service.ExplanationMode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
public class AnalysisSession {
    private final RiskScoringEngine engine;
    private final ScheduledExecutorService scheduler;
    private final Duration delay;

    private SessionState state = SessionState.IDLE;
    private String text = "";
    private String url = "";
    private AnalysisResult result;
    private ExplanationMode explanationMode = ExplanationMode.NORMAL;

    private long run;
    private ScheduledFuture<?> pending;
    private CompletableFuture<AnalysisResult> completion = new CompletableFuture<>();

    public AnalysisSession(RiskScoringEngine engine, ScheduledExecutorService scheduler, Duration delay) {
        this.engine = engine;
        this.scheduler = scheduler;
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    public synchronized void updateForm(String text, String url) {
        requireState(SessionState.IDLE, "updateForm");
        this.text = text == null ? "" : text;
        this.url = url == null ? "" : url;
    }

    public synchronized boolean submit() {
        requireState(SessionState.IDLE, "submit");
        if (text.isEmpty() && url.isEmpty()) {
            return false;
        }
        state = SessionState.ANALYZING;
        if (completion.isDone()) {
            completion = new CompletableFuture<>();
        }
        long current = ++run;
        String submittedText = text;
        String submittedUrl = url;

        if (delay.isZero()) {
            complete(current, engine.analyze(submittedText, submittedUrl));
        } else {
            pending = scheduler.schedule(
                    () -> complete(current, engine.analyze(submittedText, submittedUrl)),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        return true;
    }

    public synchronized void cancel() {
        requireState(SessionState.ANALYZING, "cancel");
        abandonPending();
        state = SessionState.IDLE;
    }

    public synchronized void setExplanationMode(ExplanationMode mode) {
        requireState(SessionState.RESULT, "setExplanationMode");
        this.explanationMode = mode == null ? ExplanationMode.NORMAL : mode;
    }

    public synchronized void reset() {
        if (state == SessionState.ANALYZING) {
            abandonPending();
        }
        state = SessionState.IDLE;
        text = "";
        url = "";
        result = null;
        explanationMode = ExplanationMode.NORMAL;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized String getText() {
        return text;
    }

    public synchronized String getUrl() {
        return url;
    }

    public synchronized AnalysisResult getResult() {
        return result;
    }

    public synchronized ExplanationMode getExplanationMode() {
        return explanationMode;
    }

    // pending until the next submit reaches RESULT; cancelled if that run is abandoned
    public synchronized CompletableFuture<AnalysisResult> getCompletion() {
        return completion;
    }

    private synchronized void complete(long forRun, AnalysisResult analysisResult) {
        if (forRun != run || state != SessionState.ANALYZING) {
            log.debug("Dropping stale analysis completion for run {}", forRun);
            return;
        }
        pending = null;
        result = analysisResult;
        explanationMode = ExplanationMode.NORMAL;
        state = SessionState.RESULT;
        completion.complete(analysisResult);
    }

    private void abandonPending() {
        run++;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        completion.cancel(false);
    }

    private void requireState(SessionState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException(action + " is not allowed in state " + state + ", expected " + expected);
        }
    }
}
