package com.candidateprep.coach.service;

import com.candidateprep.coach.client.CompanyResearchClient;
import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.exception.CollaboratorException;
import com.candidateprep.coach.model.ResearchData;
import com.candidateprep.coach.model.ResearchField;
import com.candidateprep.coach.model.SearchSummary;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Company research keyed by normalized company name. Every field carries its own
 * expiry and is dropped from reads once past it; a fetch or forced refresh writes
 * all four fields under a single timestamp.
 */
@Service
public class ResearchCache {

    private static final Logger log = LoggerFactory.getLogger(ResearchCache.class);

    private record CachedField(SearchSummary content, String position, Instant writtenAt, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }

    private final ConcurrentMap<String, Map<ResearchField, CachedField>> entries = new ConcurrentHashMap<>();
    private final CompanyResearchClient researchClient;
    private final CoachProperties properties;
    private final Clock clock;

    public ResearchCache(CompanyResearchClient researchClient, CoachProperties properties, Clock clock) {
        this.researchClient = researchClient;
        this.properties = properties;
        this.clock = clock;
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    /** Fresh fields only; empty when nothing for the company survives expiry. */
    public Optional<ResearchData> getResearch(String company) {
        Map<ResearchField, CachedField> entry = entries.get(key(company));
        if (entry == null) return Optional.empty();

        Instant now = clock.instant();
        Map<ResearchField, SearchSummary> fresh = new EnumMap<>(ResearchField.class);
        String position = "";
        Instant researchedAt = null;
        for (Map.Entry<ResearchField, CachedField> field : entry.entrySet()) {
            CachedField cached = field.getValue();
            if (cached.isExpired(now)) continue;
            fresh.put(field.getKey(), cached.content());
            if (field.getKey() == ResearchField.POSITION_ANALYSIS) position = cached.position();
            if (researchedAt == null || cached.writtenAt().isAfter(researchedAt)) researchedAt = cached.writtenAt();
        }

        if (fresh.isEmpty()) return Optional.empty();
        return Optional.of(new ResearchData(company.strip(), position, fresh, researchedAt, true, null));
    }

    public ResearchData getOrFetch(String company, String position, boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<ResearchData> cached = getResearch(company);
            if (cached.isPresent()) {
                log.info("Research cache hit company={} fields={}", company, cached.get().fields().keySet());
                return cached.get();
            }
        }

        log.info("Researching company={} position={} forceRefresh={}", company, position, forceRefresh);
        Map<ResearchField, SearchSummary> fields = new EnumMap<>(ResearchField.class);
        try {
            fields.put(ResearchField.OVERVIEW, researchClient.searchCompanyOverview(company));
            fields.put(ResearchField.CULTURE, researchClient.searchCompanyCulture(company));
            fields.put(ResearchField.NEWS, researchClient.searchRecentNews(company, properties.getNewsLookbackDays()));
            fields.put(ResearchField.POSITION_ANALYSIS, researchClient.searchPositionInsights(company, position));
        } catch (CollaboratorException e) {
            log.warn("Research failed company={}: {}", company, e.getMessage());
            return new ResearchData(company, position, Map.of(), clock.instant(), false,
                "Company research unavailable: " + e.getMessage());
        }

        Instant writtenAt = store(company, position, fields);
        return new ResearchData(company, position, fields, writtenAt, false, null);
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    /**
     * Writes the given fields with one timestamp. Fields not named keep their
     * previous value and expiry; other companies are untouched.
     */
    public Instant store(String company, String position, Map<ResearchField, SearchSummary> fields) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(Duration.ofDays(properties.getResearchCacheTtlDays()));
        String safePosition = position == null ? "" : position.strip();

        entries.compute(key(company), (k, existing) -> {
            Map<ResearchField, CachedField> updated = existing == null
                ? new EnumMap<>(ResearchField.class)
                : new EnumMap<>(existing);
            fields.forEach((field, content) ->
                updated.put(field, new CachedField(content, safePosition, now, expiresAt)));
            return Map.copyOf(updated);
        });
        log.info("Research cached company={} fields={} expiresAt={}", company, fields.keySet(), expiresAt);
        return now;
    }

    public boolean clearCompany(String company) {
        boolean removed = entries.remove(key(company)) != null;
        log.info("Research cache cleared company={} removed={}", company, removed);
        return removed;
    }

    /** Drops every expired field, and companies left without fields. */
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger evicted = new AtomicInteger();
        for (String company : entries.keySet()) {
            entries.computeIfPresent(company, (k, existing) -> {
                Map<ResearchField, CachedField> kept = new EnumMap<>(ResearchField.class);
                existing.forEach((field, cached) -> {
                    if (cached.isExpired(now)) {
                        evicted.incrementAndGet();
                    } else {
                        kept.put(field, cached);
                    }
                });
                return kept.isEmpty() ? null : Map.copyOf(kept);
            });
        }
        log.info("Evicted {} expired research fields", evicted.get());
        return evicted.get();
    }

    public int size() {
        return entries.size();
    }

    // -------------------------------------------------------------------------
    // Prompt formatting
    // -------------------------------------------------------------------------

    /** Fresh research rendered for a prompt; empty on a miss. */
    public Optional<String> promptContext(String company) {
        return getResearch(company).map(ResearchCache::format);
    }

    public String formatForPrompt(String company) {
        return promptContext(company).orElse("No cached research available for " + company + ".");
    }

    public static String format(ResearchData research) {
        StringBuilder sb = new StringBuilder("Company: ").append(research.company());
        research.fields().entrySet().stream()
            .sorted(Map.Entry.comparingByKey(Comparator.comparingInt(ResearchField::ordinal)))
            .forEach(entry -> sb.append("\n\n## ")
                .append(entry.getKey().heading())
                .append('\n')
                .append(entry.getValue().summary()));
        return sb.toString();
    }

    private static String key(String company) {
        if (company == null || company.isBlank()) {
            throw new IllegalArgumentException("Company is required.");
        }
        return company.strip().toLowerCase(Locale.ROOT);
    }
}
