package com.candidateprep.coach.service;

import com.candidateprep.coach.model.PersonalityProfile;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Long-term candidate memory: CV chunks, tagged experiences and one personality
 * profile. Retrieval ranks entries by word overlap with the query.
 */
@Service
public class CandidateProfileStore {

    private static final Logger log = LoggerFactory.getLogger(CandidateProfileStore.class);

    static final int CHUNK_SIZE = 1000;
    static final int CHUNK_OVERLAP = 200;
    static final int TOP_K = 3;
    private static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ");

    private record Entry(String content, List<String> tags) {}

    private final List<Entry> cvChunks = new CopyOnWriteArrayList<>();
    private final List<Entry> experiences = new CopyOnWriteArrayList<>();
    private volatile PersonalityProfile personality;

    public int addCv(String cvText) {
        List<String> chunks = split(cvText);
        chunks.forEach(chunk -> cvChunks.add(new Entry(chunk, List.of())));
        log.info("CV added chunks={}", chunks.size());
        return chunks.size();
    }

    public void addExperience(String text, List<String> tags) {
        experiences.add(new Entry(text.strip(), tags == null ? List.of() : List.copyOf(tags)));
        log.info("Experience added tags={}", tags);
    }

    public void setPersonality(PersonalityProfile profile) {
        this.personality = profile;
    }

    public void clear() {
        cvChunks.clear();
        experiences.clear();
        personality = null;
    }

    public int cvChunkCount() {
        return cvChunks.size();
    }

    public int experienceCount() {
        return experiences.size();
    }

    // -------------------------------------------------------------------------
    // Retrieval
    // -------------------------------------------------------------------------

    public String retrieveCv(String query) {
        List<Entry> hits = topMatches(cvChunks, query);
        if (hits.isEmpty()) return "No relevant CV information found.";

        List<String> sections = new ArrayList<>();
        for (int i = 0; i < hits.size(); i++) {
            sections.add("[CV Section " + (i + 1) + "]\n" + hits.get(i).content());
        }
        return String.join("\n\n", sections);
    }

    public String retrieveExperiences(String query) {
        List<Entry> hits = topMatches(experiences, query);
        if (hits.isEmpty()) return "No relevant experiences found.";

        List<String> sections = new ArrayList<>();
        for (int i = 0; i < hits.size(); i++) {
            Entry hit = hits.get(i);
            String tags = hit.tags().isEmpty() ? "" : " [Tags: " + String.join(", ", hit.tags()) + "]";
            sections.add("[Experience " + (i + 1) + "]" + tags + "\n" + hit.content());
        }
        return String.join("\n\n", sections);
    }

    public String retrievePersonality() {
        PersonalityProfile profile = personality;
        if (profile == null) return "No personality profile found.";

        List<String> sections = new ArrayList<>();
        addSection(sections, "Communication Style", profile.communicationStyle());
        addSection(sections, "Work Values", join(profile.workValues()));
        addSection(sections, "Strengths", join(profile.strengths()));
        addSection(sections, "Areas for Improvement", join(profile.weaknesses()));
        addSection(sections, "Career Goals", profile.careerGoals());
        return sections.isEmpty() ? "No personality profile found." : String.join("\n\n", sections);
    }

    private List<Entry> topMatches(List<Entry> entries, String query) {
        Set<String> queryWords = words(query);
        return entries.stream()
            .sorted(Comparator.comparingDouble((Entry e) -> similarity(queryWords, words(e.content()))).reversed())
            .limit(TOP_K)
            .toList();
    }

    /** Jaccard similarity of two word sets. */
    static double similarity(Set<String> first, Set<String> second) {
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);

        Set<String> union = new HashSet<>(first);
        union.addAll(second);

        if (union.isEmpty()) return 0.0;
        return (double) intersection.size() / union.size();
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) return Set.of();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}+#]+"))
            .filter(word -> !word.isEmpty())
            .collect(Collectors.toSet());
    }

    // -------------------------------------------------------------------------
    // Chunking
    // -------------------------------------------------------------------------

    static List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) return chunks;

        String source = text.strip();
        int start = 0;
        while (start < source.length()) {
            int end = Math.min(start + CHUNK_SIZE, source.length());
            if (end < source.length()) {
                end = breakPoint(source, start, end);
            }
            String chunk = source.substring(start, end).strip();
            if (!chunk.isEmpty()) chunks.add(chunk);
            if (end >= source.length()) break;
            start = Math.max(end - CHUNK_OVERLAP, start + 1);
        }
        return chunks;
    }

    private static int breakPoint(String source, int start, int end) {
        int minimum = start + CHUNK_SIZE / 2;
        for (String separator : SEPARATORS) {
            int index = source.lastIndexOf(separator, end - separator.length());
            if (index >= minimum) return index + separator.length();
        }
        return end;
    }

    private static void addSection(List<String> sections, String label, String value) {
        if (value != null && !value.isBlank()) sections.add(label + ": " + value.strip());
    }

    private static String join(List<String> values) {
        return values == null ? null : String.join(", ", values);
    }
}
