package com.starscape.phototriage.features.grouprules.infra;

import com.starscape.phototriage.features.grouprules.domain.GroupRejection;
import com.starscape.phototriage.features.grouprules.domain.GroupRejectionRepository;
import com.starscape.phototriage.features.grouprules.domain.RuleCount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaGroupRejectionRepository extends JpaRepository<GroupRejection, String>, GroupRejectionRepository {
    
    @Override
    @Query("SELECT new com.starscape.phototriage.features.grouprules.domain.RuleCount(r.ruleName, COUNT(r)) " +
           "FROM GroupRejection r GROUP BY r.ruleName ORDER BY r.ruleName")
    List<RuleCount> countByRule();
}
