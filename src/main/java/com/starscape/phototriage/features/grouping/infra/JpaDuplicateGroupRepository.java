package com.starscape.phototriage.features.grouping.infra;

import com.starscape.phototriage.features.grouping.domain.DuplicateGroupMember;
import com.starscape.phototriage.features.grouping.domain.DuplicateGroupRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaDuplicateGroupRepository
        extends JpaRepository<DuplicateGroupMember, String>, DuplicateGroupRepository {
    
    @Override
    @Query("SELECT COUNT(DISTINCT m.groupId) FROM DuplicateGroupMember m")
    long countGroups();
}
