package com.candidateprep.coach.client;

import com.candidateprep.coach.model.SearchSummary;

/**
 * Web search collaborator the research cache calls on a miss or forced refresh.
 * Failures surface as {@link com.candidateprep.coach.exception.CollaboratorException}.
 */
public interface CompanyResearchClient {

    SearchSummary searchCompanyOverview(String company);

    SearchSummary searchCompanyCulture(String company);

    SearchSummary searchRecentNews(String company, int lookbackDays);

    SearchSummary searchPositionInsights(String company, String position);
}
