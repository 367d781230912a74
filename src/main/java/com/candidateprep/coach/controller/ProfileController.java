package com.candidateprep.coach.controller;

import com.candidateprep.coach.model.PersonalityProfile;
import com.candidateprep.coach.model.ProfileTextRequest;
import com.candidateprep.coach.service.CandidateProfileStore;
import com.candidateprep.coach.validation.RequestValidator;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profile")
public class ProfileController {

    private final CandidateProfileStore profile;
    private final RequestValidator validator;

    public ProfileController(CandidateProfileStore profile, RequestValidator validator) {
        this.profile = profile;
        this.validator = validator;
    }

    @GetMapping
    public Map<String, Object> overview() {
        return Map.of(
            "cvChunks", profile.cvChunkCount(),
            "experiences", profile.experienceCount()
        );
    }

    @PostMapping("/cv")
    public ResponseEntity<Map<String, Object>> addCv(@RequestBody ProfileTextRequest request) {
        int chunks = profile.addCv(validator.validateCv(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("chunks", chunks));
    }

    @PostMapping("/experiences")
    public ResponseEntity<Void> addExperience(@RequestBody ProfileTextRequest request) {
        String text = validator.validateExperience(request);
        profile.addExperience(text, validator.cleanTags(request.tags()));
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PutMapping("/personality")
    public ResponseEntity<Void> setPersonality(@RequestBody PersonalityProfile personality) {
        if (personality == null) throw new IllegalArgumentException("Request body is required.");
        profile.setPersonality(personality);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        profile.clear();
        return ResponseEntity.noContent().build();
    }
}
