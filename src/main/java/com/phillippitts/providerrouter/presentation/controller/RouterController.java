package com.phillippitts.providerrouter.presentation.controller;

import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.domain.ProviderHealth;
import com.phillippitts.providerrouter.service.ProviderRouter;
import com.phillippitts.providerrouter.service.selection.CandidateSelection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the router: provider health, configured capabilities and the candidates
 * a dispatch would currently try.
 */
@RestController
@RequestMapping("/api/router")
class RouterController {

    private static final Logger LOG = LogManager.getLogger(RouterController.class);

    private final ProviderRouter router;

    RouterController(ProviderRouter router) {
        this.router = router;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, ProviderHealth>> health() {
        return ResponseEntity.ok(router.healthSnapshot());
    }

    @GetMapping("/capabilities")
    ResponseEntity<List<String>> capabilities() {
        List<String> names = router.capabilities().stream().map(Capability::name).sorted().toList();
        return ResponseEntity.ok(names);
    }

    @GetMapping("/capabilities/{capability}/candidates")
    ResponseEntity<CandidatesView> candidates(@PathVariable String capability,
                                              @RequestParam(required = false) Double budgetUsd,
                                              @RequestParam(defaultValue = "0") long inputSize,
                                              @RequestParam(defaultValue = "0") long outputSize) {
        LOG.debug("Candidate listing requested: capability={}, budgetUsd={}, sizes={}/{}",
                capability, budgetUsd, inputSize, outputSize);
        CapabilityRequest<Void> request =
                new CapabilityRequest<>(Capability.of(capability), inputSize, outputSize, budgetUsd, Set.of(), null);
        CandidateSelection selection = router.selectCandidates(request);
        return ResponseEntity.ok(new CandidatesView(
                selection.capability().name(), selection.overBudget(), selection.candidates()));
    }

    record CandidatesView(String capability, boolean overBudget, List<ProviderCandidate> candidates) {}
}
