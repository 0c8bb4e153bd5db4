package com.starscape.phototriage.features.catalog.domain;

import java.util.Collection;
import java.util.List;

public interface PhotoPathRepository {
    PhotoPath save(PhotoPath path);
    <S extends PhotoPath> List<S> saveAll(Iterable<S> paths);
    List<PhotoPath> findByPhotoIdInOrderByPathIdAsc(Collection<String> photoIds);
    boolean existsByPhotoIdAndSourcePath(String photoId, String sourcePath);
    long count();
}
