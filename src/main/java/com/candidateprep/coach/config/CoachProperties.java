package com.candidateprep.coach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coach")
public class CoachProperties {
    private int maxIterations = 3;
    private double critiqueThreshold = 7.0;
    private int followUpMaxDepth = 3;
    private int researchCacheTtlDays = 7;
    private int difficultyCadence = 3;
    private int difficultyWindow = 0; // 0 = average over every recorded score
    private int conversationWindow = 10;
    private int mockQuestionCount = 15;
    private int newsLookbackDays = 180;

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public double getCritiqueThreshold() { return critiqueThreshold; }
    public void setCritiqueThreshold(double critiqueThreshold) { this.critiqueThreshold = critiqueThreshold; }
    public int getFollowUpMaxDepth() { return followUpMaxDepth; }
    public void setFollowUpMaxDepth(int followUpMaxDepth) { this.followUpMaxDepth = followUpMaxDepth; }
    public int getResearchCacheTtlDays() { return researchCacheTtlDays; }
    public void setResearchCacheTtlDays(int researchCacheTtlDays) { this.researchCacheTtlDays = researchCacheTtlDays; }
    public int getDifficultyCadence() { return difficultyCadence; }
    public void setDifficultyCadence(int difficultyCadence) { this.difficultyCadence = difficultyCadence; }
    public int getDifficultyWindow() { return difficultyWindow; }
    public void setDifficultyWindow(int difficultyWindow) { this.difficultyWindow = difficultyWindow; }
    public int getConversationWindow() { return conversationWindow; }
    public void setConversationWindow(int conversationWindow) { this.conversationWindow = conversationWindow; }
    public int getMockQuestionCount() { return mockQuestionCount; }
    public void setMockQuestionCount(int mockQuestionCount) { this.mockQuestionCount = mockQuestionCount; }
    public int getNewsLookbackDays() { return newsLookbackDays; }
    public void setNewsLookbackDays(int newsLookbackDays) { this.newsLookbackDays = newsLookbackDays; }
}
