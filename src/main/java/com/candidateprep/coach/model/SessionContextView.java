package com.candidateprep.coach.model;

import java.util.List;

/** Windowed view of the live session handed to the next pipeline invocation. */
public record SessionContextView(
    String sessionId,
    JobContext job,
    List<String> keyRequirements,
    ResearchData researchData,
    InterviewMode mode,
    List<ConversationEntry> conversationHistory,
    int followUpDepth,
    boolean awaitingFollowUp
) {}
