package com.lexbridge.backend.controller;

import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.service.AdvocateDirectory;
import com.lexbridge.backend.service.AdvocateMatch;
import com.lexbridge.backend.service.CaseLifecycleManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Directory lookups that need no case: ranking a draft profile and reading a
 * public advocate record.
 */
@RestController
public class MatchController extends AbstractController {

    private final CaseLifecycleManager lifecycleManager;
    private final AdvocateDirectory advocateDirectory;

    public MatchController(CaseLifecycleManager lifecycleManager, AdvocateDirectory advocateDirectory) {
        this.lifecycleManager = lifecycleManager;
        this.advocateDirectory = advocateDirectory;
    }

    @PostMapping("/matches/preview")
    public ResponseEntity<List<AdvocateMatch>> preview(@RequestBody CaseProfile profile,
                                                       @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(lifecycleManager.previewRecommendations(profile, limit));
    }

    @GetMapping("/advocates/{advocateId}")
    public ResponseEntity<AdvocateCapability> getAdvocate(@PathVariable String advocateId) {
        return ResponseEntity.ok(advocateDirectory.get(advocateId));
    }
}
