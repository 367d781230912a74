package com.candidateprep.coach.controller;

import com.candidateprep.coach.model.ResearchData;
import com.candidateprep.coach.service.ResearchCache;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/research")
public class ResearchController {

    private final ResearchCache researchCache;

    public ResearchController(ResearchCache researchCache) {
        this.researchCache = researchCache;
    }

    @GetMapping("/{company}")
    public ResponseEntity<ResearchData> cached(@PathVariable String company) {
        return researchCache.getResearch(company)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{company}/context", produces = MediaType.TEXT_PLAIN_VALUE)
    public String promptContext(@PathVariable String company) {
        return researchCache.formatForPrompt(company);
    }

    @DeleteMapping("/expired")
    public Map<String, Object> evictExpired() {
        return Map.of("evicted", researchCache.evictExpired());
    }

    @DeleteMapping("/{company}")
    public ResponseEntity<Void> clear(@PathVariable String company) {
        return researchCache.clearCompany(company)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }
}
