package com.starscape.phototriage.features.catalog.domain;

import java.util.List;
import java.util.Optional;

public interface PhotoRepository {
    Photo save(Photo photo);
    <S extends Photo> List<S> saveAll(Iterable<S> photos);
    Optional<Photo> findById(String photoId);
    List<Photo> findAllById(Iterable<String> photoIds);
    long count();
    long countByPrimaryHashIsNotNull();
    
    /** Photos without an individual decision, ordered by id. */
    List<Photo> findUndecided();
    
    /** Photos without an individual decision that carry a primary hash, ordered by id. */
    List<Photo> findGroupingCandidates();
}
