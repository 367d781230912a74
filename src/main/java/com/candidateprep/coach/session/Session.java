package com.candidateprep.coach.session;

import com.candidateprep.coach.model.ConversationEntry;
import com.candidateprep.coach.model.InterviewMode;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.ResearchData;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

class Session {

    final String id;
    final JobContext job;
    final List<String> keyRequirements = new ArrayList<>();
    final PracticeSubstate practice = new PracticeSubstate();
    final MockSubstate mock = new MockSubstate();
    final List<ConversationEntry> conversationHistory = new ArrayList<>();
    final Instant createdAt;

    InterviewMode mode;
    ResearchData researchData;
    String currentQuestion;
    String currentAnswer;
    boolean awaitingFollowUp;
    int followUpDepth;
    Instant updatedAt;

    Session(String id, JobContext job, InterviewMode mode, Instant createdAt) {
        this.id = id;
        this.job = job;
        this.mode = mode;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }
}
