package com.starscape.phototriage.features.grouping.domain;

import java.util.List;

public interface DuplicateGroupRepository {
    <S extends DuplicateGroupMember> List<S> saveAll(Iterable<S> members);
    List<DuplicateGroupMember> findAllByOrderByGroupIdAscPhotoIdAsc();
    long count();
    long countGroups();
    void deleteAllInBatch();
}
