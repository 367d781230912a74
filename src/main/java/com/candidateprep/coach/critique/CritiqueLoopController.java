package com.candidateprep.coach.critique;

import com.candidateprep.coach.client.CoachingModel;
import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.exception.CollaboratorException;
import com.candidateprep.coach.model.AnswerBrief;
import com.candidateprep.coach.model.CritiqueResult;
import com.candidateprep.coach.model.IterationRecord;
import com.candidateprep.coach.model.ParseOutcome;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.Question;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.model.RetrievedContext;
import com.candidateprep.coach.service.CandidateProfileStore;
import com.candidateprep.coach.service.ResearchCache;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one question through analyze, retrieve, generate, critique, the optional
 * regenerate cycle, refine, key-point extraction and follow-up prediction.
 *
 * <p>Always returns a result. Generation and critique are required calls: their
 * failures are reported in {@link QuestionResult#error()}. Every other call
 * degrades to fallback content with a warning. Each state's handler returns the
 * next state and every move is checked against {@link LoopTransitions}.
 */
@Component
public class CritiqueLoopController {

    private static final Logger log = LoggerFactory.getLogger(CritiqueLoopController.class);

    private final CoachingModel model;
    private final CandidateProfileStore profile;
    private final ResearchCache researchCache;
    private final StructuredOutputParser parser;
    private final CoachProperties properties;
    private final Clock clock;

    public CritiqueLoopController(
        CoachingModel model,
        CandidateProfileStore profile,
        ResearchCache researchCache,
        StructuredOutputParser parser,
        CoachProperties properties,
        Clock clock
    ) {
        this.model = model;
        this.profile = profile;
        this.researchCache = researchCache;
        this.parser = parser;
        this.properties = properties;
        this.clock = clock;
    }

    public QuestionResult process(Question question) {
        return process(question, null);
    }

    /**
     * @param previous the exchange a follow-up refers to, or null for a top-level question
     */
    public QuestionResult process(Question question, PreviousExchange previous) {
        LoopContext ctx = new LoopContext(question, previous);
        LoopState state = LoopState.ANALYZE;

        while (!state.isTerminal()) {
            LoopState next = step(state, ctx);
            LoopTransitions.check(state, next);
            state = next;
        }

        log.info("Question processed state={} iterations={} score={} degraded={}",
            state, ctx.iterations,
            ctx.critique == null ? "n/a" : ctx.critique.value().overall(),
            ctx.critique != null && ctx.critique.isFallback());
        return ctx.toResult(state);
    }

    private LoopState step(LoopState state, LoopContext ctx) {
        return switch (state) {
            case ANALYZE -> analyze(ctx);
            case RETRIEVE -> retrieve(ctx);
            case GENERATE -> generate(ctx);
            case CRITIQUE -> critique(ctx);
            case ITERATE -> LoopState.GENERATE;
            case REFINE -> refine(ctx);
            case EXTRACT -> extract(ctx);
            case PREDICT_FOLLOWUPS -> predictFollowUps(ctx);
            case DONE, ERROR -> throw new IllegalStateException("No step from terminal state " + state);
        };
    }

    // -------------------------------------------------------------------------
    // States
    // -------------------------------------------------------------------------

    private LoopState analyze(LoopContext ctx) {
        try {
            ctx.analysis = model.analyzeQuestion(ctx.question);
        } catch (CollaboratorException e) {
            log.warn("Question analysis unavailable: {}", e.getMessage());
        }
        return LoopState.RETRIEVE;
    }

    private LoopState retrieve(LoopContext ctx) {
        String query = ctx.question.text();
        String company = "";
        if (ctx.question.context().hasCompany()) {
            company = researchCache.promptContext(ctx.question.context().company()).orElse("");
        }
        ctx.context = new RetrievedContext(
            profile.retrieveCv(query),
            profile.retrieveExperiences(query),
            profile.retrievePersonality(),
            company,
            ctx.previous
        );
        return LoopState.GENERATE;
    }

    private LoopState generate(LoopContext ctx) {
        AnswerBrief brief = new AnswerBrief(ctx.question, ctx.analysis, ctx.context, ctx.corrections());
        try {
            ctx.draft = model.draftAnswer(brief);
            ctx.iterations++;
            return LoopState.CRITIQUE;
        } catch (CollaboratorException e) {
            ctx.recordError("Answer generation failed: " + e.getMessage());
            ctx.shouldIterate = false;
            if (ctx.draft == null) {
                log.warn("Answer generation failed with no draft: {}", e.getMessage());
                return LoopState.ERROR;
            }
            log.warn("Regeneration failed after {} iterations, refining last draft: {}",
                ctx.iterations, e.getMessage());
            return LoopState.REFINE;
        }
    }

    private LoopState critique(LoopContext ctx) {
        ParseOutcome<CritiqueResult> outcome;
        try {
            String raw = model.critiqueAnswer(ctx.question.text(), ctx.draft, ctx.context.cv());
            outcome = parser.parseCritique(raw);
        } catch (CollaboratorException e) {
            ctx.recordError("Critique failed: " + e.getMessage());
            outcome = ParseOutcome.fallback(CritiqueResult.neutral(), "critique unavailable");
        }

        if (ctx.context.hasCompanyContext()) {
            outcome = withAlignment(outcome, ctx);
        }

        ctx.critique = outcome;
        double overall = outcome.value().overall();
        ctx.history.add(new IterationRecord(ctx.iterations, overall, outcome.isFallback(), clock.instant()));
        ctx.shouldIterate = LoopTransitions.shouldIterate(
            overall, ctx.iterations, properties.getCritiqueThreshold(), properties.getMaxIterations());

        log.debug("Critique iteration={} score={} iterate={}", ctx.iterations, overall, ctx.shouldIterate);
        return ctx.shouldIterate ? LoopState.ITERATE : LoopState.REFINE;
    }

    private ParseOutcome<CritiqueResult> withAlignment(ParseOutcome<CritiqueResult> outcome, LoopContext ctx) {
        String alignment;
        try {
            alignment = model.assessAlignment(ctx.draft, ctx.context.company());
        } catch (CollaboratorException e) {
            log.warn("Company alignment unavailable: {}", e.getMessage());
            return outcome;
        }
        CritiqueResult aligned = outcome.value().withAlignment(alignment);
        if (outcome instanceof ParseOutcome.Fallback<CritiqueResult> fallback) {
            return ParseOutcome.fallback(aligned, fallback.reason());
        }
        return ParseOutcome.parsed(aligned);
    }

    private LoopState refine(LoopContext ctx) {
        try {
            String polished = model.polishAnswer(ctx.draft, ctx.critique.value().strengths());
            ctx.finalAnswer = polished == null || polished.isBlank() ? ctx.draft : polished;
        } catch (CollaboratorException e) {
            log.warn("Refinement skipped: {}", e.getMessage());
            ctx.finalAnswer = ctx.draft;
        }
        return LoopState.EXTRACT;
    }

    private LoopState extract(LoopContext ctx) {
        try {
            ctx.keyPoints = parser.parseKeyPoints(model.extractKeyPoints(ctx.question.text(), ctx.finalAnswer)).value();
        } catch (CollaboratorException e) {
            log.warn("Key point extraction unavailable: {}", e.getMessage());
        }
        return LoopState.PREDICT_FOLLOWUPS;
    }

    private LoopState predictFollowUps(LoopContext ctx) {
        try {
            ctx.followUps = parser.parseFollowUps(model.predictFollowUps(ctx.question.text(), ctx.finalAnswer)).value();
        } catch (CollaboratorException e) {
            log.warn("Follow-up prediction unavailable: {}", e.getMessage());
        }
        return LoopState.DONE;
    }
}
