package com.starscape.phototriage.features.grouprules.domain;

import java.util.List;

public interface GroupRejectionRepository {
    <S extends GroupRejection> List<S> saveAll(Iterable<S> rejections);
    List<GroupRejection> findByGroupId(String groupId);
    long count();
    void deleteAllInBatch();
    List<RuleCount> countByRule();
}
