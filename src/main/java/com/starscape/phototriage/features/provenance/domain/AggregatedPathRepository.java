package com.starscape.phototriage.features.provenance.domain;

import java.util.List;

public interface AggregatedPathRepository {
    <S extends AggregatedPath> List<S> saveAll(Iterable<S> paths);
    List<AggregatedPath> findByKeptPhotoIdOrderByIdAsc(String keptPhotoId);
    long count();
    long countKeptPhotos();
    void deleteAllInBatch();
}
