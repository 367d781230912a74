package com.candidateprep.coach.controller;

import com.candidateprep.coach.service.ResearchCache;
import com.candidateprep.coach.session.SessionRegistry;
import java.time.Clock;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final ResearchCache researchCache;
    private final SessionRegistry sessions;
    private final Clock clock;

    public HealthController(ResearchCache researchCache, SessionRegistry sessions, Clock clock) {
        this.researchCache = researchCache;
        this.sessions = sessions;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
            "status", "up",
            "cachedCompanies", researchCache.size(),
            "activeSessions", sessions.activeSessionCount(),
            "knownClients", sessions.clientCount(),
            "timestamp", clock.instant().toString()
        );
    }
}
