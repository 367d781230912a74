package com.candidateprep.coach.client;

import com.candidateprep.coach.exception.CollaboratorException;
import com.candidateprep.coach.model.SearchSummary;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class TavilySearchClient implements CompanyResearchClient {

    private static final Logger log = LoggerFactory.getLogger(TavilySearchClient.class);

    static final String COLLABORATOR = "tavily";
    private static final int MAX_RESULTS = 5;

    private final RestClient restClient;
    private final String apiKey;
    private final String apiUrl;

    public TavilySearchClient(
        @Qualifier("tavilyRestClient") RestClient restClient,
        @Value("${tavily.api.key}") String apiKey,
        @Value("${tavily.api.url:https://api.tavily.com/search}") String apiUrl
    ) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
    }

    @Override
    public SearchSummary searchCompanyOverview(String company) {
        return search(company + " company overview mission values", "advanced", null);
    }

    @Override
    public SearchSummary searchCompanyCulture(String company) {
        return search(company + " company culture work environment employee reviews", "advanced", null);
    }

    @Override
    public SearchSummary searchRecentNews(String company, int lookbackDays) {
        return search(company + " recent news updates", "basic", lookbackDays);
    }

    @Override
    public SearchSummary searchPositionInsights(String company, String position) {
        String query = company == null || company.isBlank()
            ? position + " job requirements responsibilities skills"
            : position + " at " + company + " job requirements responsibilities";
        return search(query, "advanced", null);
    }

    // -------------------------------------------------------------------------
    // HTTP
    // -------------------------------------------------------------------------

    private SearchSummary search(String query, String depth, Integer newsDays) {
        var body = new HashMap<String, Object>();
        body.put("api_key", apiKey);
        body.put("query", query);
        body.put("max_results", MAX_RESULTS);
        body.put("search_depth", depth);
        body.put("include_answer", true);
        if (newsDays != null) {
            body.put("topic", "news");
            body.put("days", newsDays);
        }

        Map<?, ?> response;
        try {
            response = restClient.post()
                .uri(apiUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(Map.class);
        } catch (RestClientResponseException e) {
            throw new CollaboratorException(COLLABORATOR,
                "Search failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new CollaboratorException(COLLABORATOR, "Search request failed: " + e.getMessage(), e);
        }

        SearchSummary summary = toSummary(response);
        log.debug("Search done query='{}' sources={}", query, summary.sources().size());
        return summary;
    }

    private SearchSummary toSummary(Map<?, ?> response) {
        if (response == null) throw new CollaboratorException(COLLABORATOR, "Empty search response");

        List<String> sources = new ArrayList<>();
        StringBuilder formatted = new StringBuilder();
        if (response.get("results") instanceof List<?> results) {
            for (Object item : results) {
                if (!(item instanceof Map<?, ?> result)) continue;
                String title = asText(result.get("title"));
                String content = asText(result.get("content"));
                String url = asText(result.get("url"));
                if (!url.isEmpty()) sources.add(url);
                if (!formatted.isEmpty()) formatted.append("\n\n");
                formatted.append(title).append('\n').append(content);
            }
        }

        String answer = asText(response.get("answer"));
        String summary = answer.isEmpty() ? formatted.toString().trim() : answer;
        return new SearchSummary(summary, sources);
    }

    private static String asText(Object value) {
        return value instanceof String s ? s.trim() : "";
    }
}
