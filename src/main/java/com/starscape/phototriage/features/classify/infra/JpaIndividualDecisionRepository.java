package com.starscape.phototriage.features.classify.infra;

import com.starscape.phototriage.features.classify.domain.DecisionCount;
import com.starscape.phototriage.features.classify.domain.IndividualDecision;
import com.starscape.phototriage.features.classify.domain.IndividualDecisionRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaIndividualDecisionRepository
        extends JpaRepository<IndividualDecision, String>, IndividualDecisionRepository {
    
    @Override
    @Query("SELECT new com.starscape.phototriage.features.classify.domain.DecisionCount(" +
           "d.decision, d.ruleName, COUNT(d)) FROM IndividualDecision d " +
           "GROUP BY d.decision, d.ruleName ORDER BY d.decision, d.ruleName")
    List<DecisionCount> countByDecisionAndRule();
}
