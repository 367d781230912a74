package com.candidateprep.coach.critique;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.candidateprep.coach.client.CoachingModel;
import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.exception.CollaboratorException;
import com.candidateprep.coach.model.AnswerBrief;
import com.candidateprep.coach.model.IterationRecord;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.Question;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.model.ResearchData;
import com.candidateprep.coach.model.ResearchField;
import com.candidateprep.coach.model.SearchSummary;
import com.candidateprep.coach.service.CandidateProfileStore;
import com.candidateprep.coach.service.ResearchCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CritiqueLoopControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String KEY_POINTS = """
        {"key_points": ["Led the migration"], "delivery_tips": ["Slow down"]}
        """;
    private static final String FOLLOW_UPS = """
        {"follow_ups": [{"question": "What would you change?", "reason": "Probes reflection", "guidance": "Be honest"}]}
        """;

    @Mock
    private CoachingModel model;
    @Mock
    private CandidateProfileStore profile;
    @Mock
    private ResearchCache researchCache;

    private CoachProperties properties;
    private CritiqueLoopController controller;

    @BeforeEach
    void setUp() {
        properties = new CoachProperties();
        properties.setCritiqueThreshold(7.0);
        properties.setMaxIterations(3);
        controller = new CritiqueLoopController(
            model,
            profile,
            researchCache,
            new StructuredOutputParser(new ObjectMapper()),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );

        lenient().when(profile.retrieveCv(anyString())).thenReturn("[CV Section 1]\nJava, Kafka");
        lenient().when(profile.retrieveExperiences(anyString())).thenReturn("[Experience 1]\nMigration project");
        lenient().when(profile.retrievePersonality()).thenReturn("Communication Style: direct");
        lenient().when(model.analyzeQuestion(any())).thenReturn("Behavioral; use STAR");
        lenient().when(model.polishAnswer(anyString(), any())).thenReturn("polished answer");
        lenient().when(model.extractKeyPoints(anyString(), anyString())).thenReturn(KEY_POINTS);
        lenient().when(model.predictFollowUps(anyString(), anyString())).thenReturn(FOLLOW_UPS);
    }

    @Test
    void stopsAtIterationBoundWhenScoreStaysLow() {
        when(model.draftAnswer(any())).thenReturn("draft 1", "draft 2", "draft 3");
        when(model.critiqueAnswer(anyString(), anyString(), anyString()))
            .thenReturn(critique(5.0), critique(6.9), critique(6.9));

        QuestionResult result = controller.process(question("Tell me about a hard project"));

        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.shouldIterate()).isFalse();
        assertThat(result.finalState()).isEqualTo(LoopState.DONE);
        assertThat(result.critique().isFallback()).isFalse();
        assertThat(result.critique().value().overall()).isEqualTo(6.9);
        assertThat(result.iterationHistory())
            .extracting(IterationRecord::iteration, IterationRecord::score)
            .containsExactly(
                tuple(1, 5.0),
                tuple(2, 6.9),
                tuple(3, 6.9));
        assertThat(result.answer()).isEqualTo("polished answer");
        verify(model).polishAnswer("draft 3", List.of("Clear structure"));
    }

    @Test
    void scoreEqualToThresholdStopsAfterOneIteration() {
        when(model.draftAnswer(any())).thenReturn("only draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(7.0));

        QuestionResult result = controller.process(question("Why this company?"));

        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.shouldIterate()).isFalse();
        verify(model, times(1)).draftAnswer(any());
    }

    @Test
    void neverExceedsMaxIterations() {
        properties.setMaxIterations(2);
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(1.0));

        QuestionResult result = controller.process(question("Describe a failure"));

        assertThat(result.iterations()).isEqualTo(2);
        verify(model, times(2)).critiqueAnswer(anyString(), anyString(), anyString());
    }

    @Test
    void laterDraftsReceivePreviousImprovementsAsCorrections() {
        when(model.draftAnswer(any())).thenReturn("draft 1", "draft 2");
        when(model.critiqueAnswer(anyString(), anyString(), anyString()))
            .thenReturn(critique(5.0), critique(8.0));

        controller.process(question("Tell me about conflict"));

        ArgumentCaptor<AnswerBrief> briefs = ArgumentCaptor.forClass(AnswerBrief.class);
        verify(model, times(2)).draftAnswer(briefs.capture());
        assertThat(briefs.getAllValues().get(0).corrections()).isEmpty();
        assertThat(briefs.getAllValues().get(1).corrections()).containsExactly("Add metrics");
        assertThat(briefs.getAllValues().get(1).analysis()).isEqualTo("Behavioral; use STAR");
    }

    @Test
    void unreadableCritiqueFallsBackToNeutralScores() {
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn("Great answer, 8/10!");

        QuestionResult result = controller.process(question("Strengths?"));

        assertThat(result.critique().isFallback()).isTrue();
        assertThat(result.critique().value().overall()).isEqualTo(7.0);
        assertThat(result.critique().value().scores()).hasSize(6).containsValue(7.0);
        assertThat(result.critique().value().strengths()).containsExactly("Answer provided");
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.iterationHistory().get(0).degraded()).isTrue();
        assertThat(result.error()).isNull();
    }

    @Test
    void critiqueFailureDegradesAndReportsError() {
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString()))
            .thenThrow(new CollaboratorException("groq", "timeout"));

        QuestionResult result = controller.process(question("Weaknesses?"));

        assertThat(result.finalState()).isEqualTo(LoopState.DONE);
        assertThat(result.critique().isFallback()).isTrue();
        assertThat(result.error()).contains("Critique failed");
        assertThat(result.answer()).isEqualTo("polished answer");
    }

    @Test
    void assessesAlignmentOnlyWithCachedCompanyResearch() {
        ResearchData research = new ResearchData("Acme", "Engineer",
            Map.of(ResearchField.CULTURE, new SearchSummary("Customer obsessed", List.of())),
            NOW, true, null);
        when(researchCache.promptContext("Acme")).thenReturn(Optional.of(ResearchCache.format(research)));
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(8.0));
        when(model.assessAlignment(eq("draft"), anyString())).thenReturn("Strong fit");

        QuestionResult result = controller.process(
            Question.practice("Why Acme?", new JobContext("Acme", "Engineer", "")));

        assertThat(result.critique().value().alignment()).isEqualTo("Strong fit");
        assertThat(result.critique().isFallback()).isFalse();
    }

    @Test
    void skipsAlignmentWithoutCachedResearch() {
        when(researchCache.promptContext("Acme")).thenReturn(Optional.empty());
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(8.0));

        QuestionResult result = controller.process(
            Question.practice("Why Acme?", new JobContext("Acme", "Engineer", "")));

        assertThat(result.critique().value().alignment()).isNull();
        verify(model, never()).assessAlignment(anyString(), anyString());
    }

    @Test
    void firstGenerationFailureEndsInError() {
        when(model.draftAnswer(any())).thenThrow(new CollaboratorException("groq", "connection refused"));

        QuestionResult result = controller.process(question("Tell me about yourself"));

        assertThat(result.finalState()).isEqualTo(LoopState.ERROR);
        assertThat(result.iterations()).isZero();
        assertThat(result.critique()).isNull();
        assertThat(result.scored()).isFalse();
        assertThat(result.error()).contains("Answer generation failed");
        assertThat(result.answer()).isNotBlank();
        assertThat(result.keyPoints()).containsExactly("Review the full answer");
        assertThat(result.followUps()).isEmpty();
        verify(model, never()).critiqueAnswer(anyString(), anyString(), anyString());
    }

    @Test
    void laterGenerationFailureRefinesLastGoodDraft() {
        when(model.draftAnswer(any()))
            .thenReturn("draft 1")
            .thenThrow(new CollaboratorException("groq", "503"));
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(4.0));

        QuestionResult result = controller.process(question("Biggest achievement?"));

        assertThat(result.finalState()).isEqualTo(LoopState.DONE);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.shouldIterate()).isFalse();
        assertThat(result.error()).contains("Answer generation failed");
        verify(model).polishAnswer("draft 1", List.of("Clear structure"));
    }

    @Test
    void refineFailureKeepsLatestDraft() {
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(9.0));
        when(model.polishAnswer(anyString(), any())).thenThrow(new CollaboratorException("groq", "timeout"));

        QuestionResult result = controller.process(question("Leadership example?"));

        assertThat(result.answer()).isEqualTo("draft");
        assertThat(result.error()).isNull();
    }

    @Test
    void unreadableExtractionAndPredictionUseFallbacks() {
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(9.0));
        when(model.extractKeyPoints(anyString(), anyString())).thenReturn("- point one\n- point two");
        when(model.predictFollowUps(anyString(), anyString())).thenReturn("Maybe they ask about scale.");

        QuestionResult result = controller.process(question("Design a cache"));

        assertThat(result.keyPoints()).containsExactly("Review the full answer");
        assertThat(result.deliveryTips()).containsExactly("Practice delivery out loud");
        assertThat(result.followUps()).isEmpty();
        assertThat(result.finalState()).isEqualTo(LoopState.DONE);
    }

    @Test
    void returnsExtractedPointsAndFollowUps() {
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(9.0));

        QuestionResult result = controller.process(question("Tell me about a migration"));

        assertThat(result.keyPoints()).containsExactly("Led the migration");
        assertThat(result.deliveryTips()).containsExactly("Slow down");
        assertThat(result.followUps()).hasSize(1);
        assertThat(result.followUps().get(0).question()).isEqualTo("What would you change?");
        assertThat(result.analysis()).isEqualTo("Behavioral; use STAR");
    }

    @Test
    void followUpCarriesPreviousExchangeIntoContext() {
        when(model.draftAnswer(any())).thenReturn("draft");
        when(model.critiqueAnswer(anyString(), anyString(), anyString())).thenReturn(critique(9.0));
        PreviousExchange previous = new PreviousExchange("Original question", "Original answer");

        controller.process(question("Why did you choose Kafka?"), previous);

        ArgumentCaptor<AnswerBrief> brief = ArgumentCaptor.forClass(AnswerBrief.class);
        verify(model).draftAnswer(brief.capture());
        assertThat(brief.getValue().context().previous()).isEqualTo(previous);
        assertThat(brief.getValue().context().cv()).contains("Kafka");
    }

    private static Question question(String text) {
        return Question.practice(text, JobContext.empty());
    }

    private static String critique(double overall) {
        return """
            {"scores": {"authenticity": %1$s, "relevance": %1$s, "structure": %1$s,
                        "specificity": %1$s, "impact": %1$s, "length": %1$s},
             "overall": %1$s,
             "strengths": ["Clear structure"],
             "improvements": ["Add metrics"]}
            """.formatted(overall);
    }
}
