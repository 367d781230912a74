package com.candidateprep.coach.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.candidateprep.coach.exception.SessionStateException;
import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.MockQuestion;
import com.candidateprep.coach.model.MockQuestionPrompt;
import com.candidateprep.coach.model.QuestionType;
import com.candidateprep.coach.service.InterviewCoachOrchestrator;
import com.candidateprep.coach.service.RateLimiterService;
import com.candidateprep.coach.validation.RequestValidator;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MockInterviewController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(RequestValidator.class)
class MockInterviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InterviewCoachOrchestrator orchestrator;

    @MockBean
    private RateLimiterService rateLimiterService;

    @Test
    void startReturnsFirstQuestionWithIndexAndTotal() throws Exception {
        MockQuestion question = new MockQuestion("Design a rate limiter", QuestionType.TECHNICAL, Difficulty.MEDIUM,
            Set.of("systems"), "Direct");
        when(orchestrator.startMockInterview("carol")).thenReturn(new MockQuestionPrompt(question, 1, 15));

        mockMvc.perform(post("/api/mock-interview/start").header("X-Client-Id", "carol"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.currentIndex").value(1))
            .andExpect(jsonPath("$.totalQuestions").value(15))
            .andExpect(jsonPath("$.question.type").value("technical"))
            .andExpect(jsonPath("$.question.difficulty").value("medium"));
    }

    @Test
    void startWithoutPreparationIsConflict() throws Exception {
        when(orchestrator.startMockInterview(any()))
            .thenThrow(new SessionStateException("No mock questions available. Prepare for the interview first."));

        mockMvc.perform(post("/api/mock-interview/start"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("No mock questions available. Prepare for the interview first."));
    }

    @Test
    void nextAfterLastQuestionIsNoContent() throws Exception {
        when(orchestrator.nextMockQuestion(any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/mock-interview/next"))
            .andExpect(status().isNoContent());
    }

    @Test
    void preparationRequiresCompanyAndPosition() throws Exception {
        mockMvc.perform(post("/api/mock-interview/prepare")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company\": \"Acme\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Position is required."));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void preparationPassesRefreshFlag() throws Exception {
        when(orchestrator.prepareForInterview(any(), any(), eq(true), any())).thenReturn(null);

        mockMvc.perform(post("/api/mock-interview/prepare")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company\": \"Acme\", \"position\": \"SRE\", \"forceRefresh\": true}"))
            .andExpect(status().isOk());
    }
}
