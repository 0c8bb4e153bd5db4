package com.starscape.phototriage.features.classify.domain;

import java.util.List;
import java.util.Optional;

public interface IndividualDecisionRepository {
    IndividualDecision save(IndividualDecision decision);
    <S extends IndividualDecision> List<S> saveAll(Iterable<S> decisions);
    Optional<IndividualDecision> findById(String photoId);
    List<IndividualDecision> findAllById(Iterable<String> photoIds);
    long count();
    void deleteAllInBatch();
    List<DecisionCount> countByDecisionAndRule();
}
