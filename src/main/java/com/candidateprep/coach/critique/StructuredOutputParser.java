package com.candidateprep.coach.critique;

import com.candidateprep.coach.model.CritiqueResult;
import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.FollowUpPrediction;
import com.candidateprep.coach.model.KeyPoints;
import com.candidateprep.coach.model.MockQuestion;
import com.candidateprep.coach.model.MockQuestionBrief;
import com.candidateprep.coach.model.ParseOutcome;
import com.candidateprep.coach.model.QuestionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the JSON the model was asked for. Never throws: unreadable or incomplete
 * output becomes a {@link ParseOutcome.Fallback} holding the documented default.
 */
@Component
public class StructuredOutputParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    private enum Shape { OBJECT, ARRAY }

    private final ObjectMapper objectMapper;
    private final ObjectMapper lenientMapper;

    public StructuredOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lenientMapper = objectMapper.copy()
            .configure(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature(), true);
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    public ParseOutcome<CritiqueResult> parseCritique(String raw) {
        return parse("critique", raw, Shape.OBJECT, this::readCritique, CritiqueResult::neutral);
    }

    public ParseOutcome<KeyPoints> parseKeyPoints(String raw) {
        return parse("key points", raw, Shape.OBJECT, this::readKeyPoints, KeyPoints::generic);
    }

    public ParseOutcome<List<FollowUpPrediction>> parseFollowUps(String raw) {
        return parse("follow-ups", raw, Shape.OBJECT, this::readFollowUps, List::of);
    }

    public ParseOutcome<List<MockQuestion>> parseMockQuestions(String raw, MockQuestionBrief brief) {
        return parse("mock questions", raw, Shape.ARRAY,
            node -> readMockQuestions(node, brief.type(), brief.difficulty()), List::of);
    }

    // -------------------------------------------------------------------------
    // Core
    // -------------------------------------------------------------------------

    private <T> ParseOutcome<T> parse(
        String label,
        String raw,
        Shape shape,
        Function<JsonNode, T> reader,
        Supplier<T> fallback
    ) {
        if (raw == null || raw.isBlank()) {
            log.warn("Empty {} output, using fallback", label);
            return ParseOutcome.fallback(fallback.get(), "empty output");
        }
        try {
            JsonNode node = readTree(extract(normalizeJson(raw), shape));
            return ParseOutcome.parsed(reader.apply(node));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} output, using fallback: {}", label, summarize(raw));
            return ParseOutcome.fallback(fallback.get(), "malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Incomplete {} output, using fallback: {}", label, e.getMessage());
            return ParseOutcome.fallback(fallback.get(), e.getMessage());
        }
    }

    private JsonNode readTree(String json) throws JsonProcessingException {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return lenientMapper.readTree(json);
        }
    }

    // -------------------------------------------------------------------------
    // Readers
    // -------------------------------------------------------------------------

    private CritiqueResult readCritique(JsonNode node) {
        requireObject(node);
        JsonNode scoresNode = node.path("scores");
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String name : CritiqueResult.SCORE_NAMES) {
            Double value = number(scoresNode.path(name));
            if (value == null) value = number(node.path(name));
            if (value != null) scores.put(name, clampScore(value));
        }

        Double overall = number(node.path("overall"));
        if (overall == null) overall = number(node.path("overall_score"));
        if (overall == null) {
            if (scores.isEmpty()) throw new IllegalArgumentException("critique has no scores");
            overall = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }

        String factCheck = text(node.path("fact_check"));
        return new CritiqueResult(
            scores,
            clampScore(overall),
            strings(node.path("strengths")),
            strings(node.path("improvements")),
            factCheck.isEmpty() ? null : factCheck,
            null
        );
    }

    private KeyPoints readKeyPoints(JsonNode node) {
        requireObject(node);
        if (!node.has("key_points") && !node.has("delivery_tips")) {
            throw new IllegalArgumentException("key points missing");
        }
        return new KeyPoints(strings(node.path("key_points")), strings(node.path("delivery_tips")));
    }

    private List<FollowUpPrediction> readFollowUps(JsonNode node) {
        JsonNode items = node.isArray() ? node : node.path("follow_ups");
        if (!items.isArray()) throw new IllegalArgumentException("follow_ups is not a list");

        List<FollowUpPrediction> followUps = new ArrayList<>();
        for (JsonNode item : items) {
            String question = item.isTextual() ? item.asText().trim() : text(item.path("question"));
            if (question.isEmpty()) continue;
            followUps.add(new FollowUpPrediction(question, text(item.path("reason")), text(item.path("guidance"))));
        }
        return followUps;
    }

    private List<MockQuestion> readMockQuestions(JsonNode node, QuestionType type, Difficulty difficulty) {
        JsonNode items = node.isArray() ? node : node.path("questions");
        if (!items.isArray()) throw new IllegalArgumentException("questions is not a list");

        List<MockQuestion> questions = new ArrayList<>();
        for (JsonNode item : items) {
            String text = text(item.path("question"));
            if (text.isEmpty()) continue;
            Set<String> themes = new LinkedHashSet<>(strings(item.path("themes")));
            String framework = text(item.path("expected_framework"));
            questions.add(new MockQuestion(
                text,
                QuestionType.fromValue(text(item.path("type")), type),
                Difficulty.fromValue(text(item.path("difficulty")), difficulty),
                themes,
                framework.isEmpty() ? type.defaultFramework() : framework
            ));
        }
        return questions;
    }

    // -------------------------------------------------------------------------
    // JSON utilities
    // -------------------------------------------------------------------------

    private String normalizeJson(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private String extract(String content, Shape shape) {
        char open = shape == Shape.ARRAY ? '[' : '{';
        char close = shape == Shape.ARRAY ? ']' : '}';
        int first = content.indexOf(open);
        int last = content.lastIndexOf(close);
        if (first >= 0 && last > first) return content.substring(first, last + 1).trim();
        // an object wrapping the array is accepted too
        if (shape == Shape.ARRAY) return extract(content, Shape.OBJECT);
        return content;
    }

    private static void requireObject(JsonNode node) {
        if (!node.isObject()) throw new IllegalArgumentException("expected a JSON object");
    }

    private static Double number(JsonNode node) {
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double clampScore(double value) {
        return Math.max(0.0, Math.min(10.0, value));
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText().trim() : "";
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = text(item);
                if (!value.isEmpty()) values.add(value);
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private static String summarize(String content) {
        String s = content.replaceAll("\\s+", " ").trim();
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
