package com.starscape.phototriage.features.classify.app;

import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.classify.domain.Decision;

import java.util.List;
import java.util.Optional;

/**
 * Judges a photo on its own properties. Rejection rules are tried first, in order, then
 * separation rules; the first match wins. A photo no rule matches is accepted and gets no record.
 * <p>
 * Stateless and thread-safe; rule exceptions propagate to the caller.
 */
public class IndividualClassifier {
    
    private final List<IndividualRule> rejectionRules;
    private final List<IndividualRule> separationRules;
    
    public IndividualClassifier(List<IndividualRule> rejectionRules, List<IndividualRule> separationRules) {
        requireDecision(rejectionRules, Decision.REJECT);
        requireDecision(separationRules, Decision.SEPARATE);
        this.rejectionRules = List.copyOf(rejectionRules);
        this.separationRules = List.copyOf(separationRules);
    }
    
    private static void requireDecision(List<IndividualRule> rules, Decision expected) {
        for (IndividualRule rule : rules) {
            if (rule.decision() != expected) {
                throw new IllegalArgumentException(
                    "Rule " + rule.name() + " yields " + rule.decision() + " but is listed with " + expected + " rules");
            }
        }
    }
    
    public Optional<Classification> classify(PhotoFacts facts) {
        Optional<Classification> rejection = firstMatch(rejectionRules, facts);
        if (rejection.isPresent()) {
            return rejection;
        }
        return firstMatch(separationRules, facts);
    }
    
    private static Optional<Classification> firstMatch(List<IndividualRule> rules, PhotoFacts facts) {
        for (IndividualRule rule : rules) {
            if (rule.matches(facts)) {
                return Optional.of(new Classification(rule.decision(), rule.name()));
            }
        }
        return Optional.empty();
    }
    
    public List<IndividualRule> getRejectionRules() {
        return rejectionRules;
    }
    
    public List<IndividualRule> getSeparationRules() {
        return separationRules;
    }
}
