package com.starscape.phototriage.features.classify.app;

import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.classify.domain.Decision;

import java.util.function.Predicate;

/**
 * A named check on a single photo and the decision it yields when it matches.
 */
public record IndividualRule(String name, Decision decision, Predicate<PhotoFacts> predicate) {
    
    public IndividualRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be blank");
        }
        if (decision == null || predicate == null) {
            throw new IllegalArgumentException("Rule " + name + " needs a decision and a predicate");
        }
    }
    
    public static IndividualRule reject(String name, Predicate<PhotoFacts> predicate) {
        return new IndividualRule(name, Decision.REJECT, predicate);
    }
    
    public static IndividualRule separate(String name, Predicate<PhotoFacts> predicate) {
        return new IndividualRule(name, Decision.SEPARATE, predicate);
    }
    
    public boolean matches(PhotoFacts facts) {
        return predicate.test(facts);
    }
}
