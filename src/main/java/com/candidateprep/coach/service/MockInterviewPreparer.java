package com.candidateprep.coach.service;

import com.candidateprep.coach.client.CoachingModel;
import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.critique.StructuredOutputParser;
import com.candidateprep.coach.exception.CollaboratorException;
import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.MockInterviewPackage;
import com.candidateprep.coach.model.MockQuestion;
import com.candidateprep.coach.model.MockQuestionBrief;
import com.candidateprep.coach.model.ParseOutcome;
import com.candidateprep.coach.model.QuestionType;
import com.candidateprep.coach.model.ResearchData;
import com.candidateprep.coach.model.ResearchField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Builds a mock interview package: company research (cached when fresh) and a
 * shuffled question set split 40% behavioral, 40% technical, rest situational.
 */
@Service
public class MockInterviewPreparer {

    private static final Logger log = LoggerFactory.getLogger(MockInterviewPreparer.class);

    private final ResearchCache researchCache;
    private final CoachingModel model;
    private final StructuredOutputParser parser;
    private final CoachProperties properties;
    private final Random random;

    @Autowired
    public MockInterviewPreparer(
        ResearchCache researchCache,
        CoachingModel model,
        StructuredOutputParser parser,
        CoachProperties properties
    ) {
        this(researchCache, model, parser, properties, new Random());
    }

    MockInterviewPreparer(
        ResearchCache researchCache,
        CoachingModel model,
        StructuredOutputParser parser,
        CoachProperties properties,
        Random random
    ) {
        this.researchCache = researchCache;
        this.model = model;
        this.parser = parser;
        this.properties = properties;
        this.random = random;
    }

    public MockInterviewPackage prepare(
        JobContext job,
        boolean forceRefresh,
        Difficulty difficulty,
        Consumer<String> progress
    ) {
        notify(progress, "Researching " + job.company() + "...");
        ResearchData research = researchCache.getOrFetch(job.company(), job.position(), forceRefresh);
        notify(progress, research.fromCache() ? "Using cached research." : "Research complete.");

        List<MockQuestion> questions = generateQuestions(job, research, difficulty, progress);

        MockInterviewPackage result = new MockInterviewPackage(
            job.company(),
            job.position(),
            job.description(),
            research,
            questions,
            questions.size(),
            difficultyDistribution(questions),
            typeDistribution(questions)
        );
        log.info("Mock interview prepared company={} questions={} types={}",
            job.company(), questions.size(), result.typeDistribution());
        return result;
    }

    /** Per-type counts for {@code total} questions; integer floors, remainder to situational. */
    static Map<QuestionType, Integer> split(int total) {
        int behavioral = (int) (total * 0.4);
        int technical = (int) (total * 0.4);
        Map<QuestionType, Integer> counts = new EnumMap<>(QuestionType.class);
        counts.put(QuestionType.BEHAVIORAL, behavioral);
        counts.put(QuestionType.TECHNICAL, technical);
        counts.put(QuestionType.SITUATIONAL, total - behavioral - technical);
        return counts;
    }

    private List<MockQuestion> generateQuestions(
        JobContext job,
        ResearchData research,
        Difficulty difficulty,
        Consumer<String> progress
    ) {
        String digest = "Overview: %s%nCulture: %s%nRecent News: %s".formatted(
            research.summary(ResearchField.OVERVIEW),
            research.summary(ResearchField.CULTURE),
            research.summary(ResearchField.NEWS));

        List<MockQuestion> questions = new ArrayList<>();
        CollaboratorException lastFailure = null;
        for (Map.Entry<QuestionType, Integer> entry : split(properties.getMockQuestionCount()).entrySet()) {
            if (entry.getValue() <= 0) continue;
            QuestionType type = entry.getKey();
            notify(progress, "Generating " + type.value() + " questions...");

            MockQuestionBrief brief = new MockQuestionBrief(type, entry.getValue(), difficulty, job, digest);
            try {
                ParseOutcome<List<MockQuestion>> parsed = parser.parseMockQuestions(model.generateMockQuestions(brief), brief);
                List<MockQuestion> generated = parsed.value();
                questions.addAll(generated.subList(0, Math.min(generated.size(), entry.getValue())));
            } catch (CollaboratorException e) {
                log.warn("Generating {} questions failed: {}", type.value(), e.getMessage());
                lastFailure = e;
            }
        }

        if (questions.isEmpty() && lastFailure != null) {
            throw lastFailure;
        }
        Collections.shuffle(questions, random);
        return questions;
    }

    private static Map<Difficulty, Integer> difficultyDistribution(List<MockQuestion> questions) {
        Map<Difficulty, Integer> distribution = new EnumMap<>(Difficulty.class);
        for (Difficulty level : Difficulty.values()) distribution.put(level, 0);
        questions.forEach(q -> distribution.merge(q.difficulty(), 1, Integer::sum));
        return distribution;
    }

    private static Map<QuestionType, Integer> typeDistribution(List<MockQuestion> questions) {
        Map<QuestionType, Integer> distribution = new EnumMap<>(QuestionType.class);
        for (QuestionType type : QuestionType.values()) distribution.put(type, 0);
        questions.forEach(q -> distribution.merge(q.type(), 1, Integer::sum));
        return distribution;
    }

    private static void notify(Consumer<String> progress, String message) {
        if (progress != null) progress.accept(message);
    }
}
