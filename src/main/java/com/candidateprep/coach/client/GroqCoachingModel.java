package com.candidateprep.coach.client;

import com.candidateprep.coach.model.AnswerBrief;
import com.candidateprep.coach.model.MockQuestionBrief;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.Question;
import com.candidateprep.coach.model.RetrievedContext;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class GroqCoachingModel implements CoachingModel {

    private static final int MAX_CONTEXT_CHARS = 4000;
    private static final int MAX_DIGEST_CHARS = 500;

    private final GroqChatClient chatClient;

    public GroqCoachingModel(GroqChatClient chatClient) {
        this.chatClient = chatClient;
    }

    // -------------------------------------------------------------------------
    // Question and answer
    // -------------------------------------------------------------------------

    @Override
    public String analyzeQuestion(Question question) {
        String systemPrompt = """
            You are an expert interview coach. Analyze the interview question and provide:
            1. Question type: Behavioral, Technical, Situational, or Other
            2. Key themes: the topics and skills it targets
            3. What they are really asking: the underlying intent
            4. Recommended framework: STAR, CAR, or Direct Answer
            5. Key points a good answer must address
            6. Pitfalls to avoid
            Be concise but thorough.
            """;

        String jobContext = question.context().hasCompany() || !question.context().position().isEmpty()
            ? "%s at %s%n%s".formatted(
                question.context().position(),
                question.context().company(),
                truncate(question.context().description(), MAX_DIGEST_CHARS))
            : "Not provided";

        return chatClient.complete(systemPrompt,
            "Interview Question: %s%n%nJob Context: %s".formatted(question.text(), jobContext),
            0.3, null);
    }

    @Override
    public String draftAnswer(AnswerBrief brief) {
        String guidance = brief.isRevision()
            ? "IMPORTANT: Address every point of the feedback from the previous draft."
            : "";
        String systemPrompt = """
            You are an expert interview coach helping a candidate prepare their answer.
            Build it only from the candidate's real CV, experiences and personality, and
            align it with the company culture when company context is given.
            Be specific: concrete details, metrics and outcomes.
            Be concise: 250-350 words, about two to three minutes spoken.
            Use STAR for behavioral questions and a direct answer for technical ones.
            %s
            Return only the answer text.
            """.formatted(guidance);

        RetrievedContext context = brief.context();
        StringBuilder user = new StringBuilder()
            .append("Interview Question:\n").append(brief.question().text()).append("\n\n")
            .append("Question Analysis:\n").append(nullSafe(brief.analysis())).append("\n\n")
            .append("Relevant CV Information:\n").append(truncate(context.cv(), MAX_CONTEXT_CHARS)).append("\n\n")
            .append("Relevant Experiences:\n").append(truncate(context.experience(), MAX_CONTEXT_CHARS)).append("\n\n")
            .append("Personality Profile:\n").append(nullSafe(context.personality())).append("\n\n")
            .append("Company Context:\n").append(truncate(context.company(), MAX_CONTEXT_CHARS)).append("\n");

        PreviousExchange previous = context.previous();
        if (previous != null) {
            user.append("\nThis is a follow-up to an earlier exchange.\n")
                .append("Original Question: ").append(previous.question()).append('\n')
                .append("Original Answer: ").append(truncate(previous.answer(), MAX_CONTEXT_CHARS)).append('\n');
        }
        if (brief.isRevision()) {
            user.append("\nPrevious Feedback to Address:\n")
                .append(String.join("\n", brief.corrections().stream().map(c -> "- " + c).toList()))
                .append('\n');
        }

        return chatClient.complete(systemPrompt, user.toString(), 0.7, null);
    }

    @Override
    public String critiqueAnswer(String question, String answer, String cvContext) {
        String systemPrompt = """
            You are an expert interview coach. Score this interview answer from 0 to 10 on:
            authenticity, relevance, structure, specificity, impact, length.
            Return ONLY valid JSON, no markdown, no explanation. Use this exact structure:
            {
              "scores": {"authenticity": 0, "relevance": 0, "structure": 0, "specificity": 0, "impact": 0, "length": 0},
              "overall": 0,
              "strengths": ["string", "string"],
              "improvements": ["string", "string"],
              "fact_check": "string"
            }
            overall is the average of the scores. fact_check says whether the answer matches the CV.
            """;

        String userContent = "Question: %s%n%nAnswer: %s%n%nCV Info: %s".formatted(
            question, answer, truncate(cvContext, MAX_CONTEXT_CHARS));
        return chatClient.complete(systemPrompt, userContent, 0.3, null);
    }

    @Override
    public String assessAlignment(String answer, String companyContext) {
        String systemPrompt = """
            Assess how well this interview answer fits the company's values and culture.
            Give a short verdict (2-3 sentences) and one concrete suggestion to strengthen the fit.
            """;
        String userContent = "Company Research:%n%s%n%nAnswer:%n%s".formatted(
            truncate(companyContext, MAX_CONTEXT_CHARS), answer);
        return chatClient.complete(systemPrompt, userContent, 0.3, 300);
    }

    @Override
    public String polishAnswer(String answer, List<String> strengths) {
        String systemPrompt = """
            You are polishing a final interview answer.
            Make it clear, well-structured and natural to say out loud.
            Preserve these strengths: %s
            Only make minor improvements to clarity and flow. Do not change the core content.
            Return only the polished answer.
            """.formatted(String.join(", ", strengths));
        return chatClient.complete(systemPrompt, "Polish this answer:\n\n" + answer, 0.4, null);
    }

    @Override
    public String extractKeyPoints(String question, String answer) {
        String systemPrompt = """
            Extract from this interview answer 3-5 key points to remember and 3-4 delivery tips
            (tone, pacing, body language).
            Return ONLY valid JSON:
            {
              "key_points": ["string"],
              "delivery_tips": ["string"]
            }
            """;
        return chatClient.complete(systemPrompt,
            "Question: %s%n%nAnswer: %s".formatted(question, answer), 0.3, 500);
    }

    @Override
    public String predictFollowUps(String question, String answer) {
        String systemPrompt = """
            Based on the interview answer, predict 2-3 likely follow-up questions an interviewer might ask.
            Return ONLY valid JSON:
            {
              "follow_ups": [
                {"question": "string", "reason": "string", "guidance": "string"}
              ]
            }
            """;
        return chatClient.complete(systemPrompt,
            "Original Question: %s%n%nAnswer Given: %s".formatted(question, answer), 0.5, 600);
    }

    // -------------------------------------------------------------------------
    // Mock interview
    // -------------------------------------------------------------------------

    @Override
    public String generateMockQuestions(MockQuestionBrief brief) {
        String style = switch (brief.type()) {
            case BEHAVIORAL -> "Use \"Tell me about a time...\" or \"Describe a situation...\" phrasing.";
            case TECHNICAL -> "Target the tools and skills in the job description. Avoid trivia.";
            case SITUATIONAL -> "Use \"What would you do if...\" or \"How would you handle...\" phrasing.";
        };
        String systemPrompt = """
            Generate %d %s interview questions for %s at %s at %s difficulty.
            %s
            Return ONLY a valid JSON array, no markdown:
            [
              {
                "question": "string",
                "type": "%s",
                "difficulty": "%s",
                "themes": ["string"],
                "expected_framework": "%s"
              }
            ]
            """.formatted(
                brief.count(),
                brief.type().value(),
                nullSafe(brief.job().position()),
                nullSafe(brief.job().company()),
                brief.difficulty().value(),
                style,
                brief.type().value(),
                brief.difficulty().value(),
                brief.type().defaultFramework());

        String userContent = "Job Description:%n%s%n%nCompany Research:%n%s".formatted(
            truncate(brief.job().description(), MAX_DIGEST_CHARS),
            truncate(brief.researchDigest(), MAX_DIGEST_CHARS));
        return chatClient.complete(systemPrompt, userContent, 0.7, 1500);
    }

    // -------------------------------------------------------------------------
    // Misc helpers
    // -------------------------------------------------------------------------

    private static String truncate(String value, int max) {
        if (value == null) return "";
        String trimmed = value.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    private static String nullSafe(String value) {
        return value == null ? "" : value;
    }
}
