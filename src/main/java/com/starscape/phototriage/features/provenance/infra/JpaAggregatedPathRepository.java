package com.starscape.phototriage.features.provenance.infra;

import com.starscape.phototriage.features.provenance.domain.AggregatedPath;
import com.starscape.phototriage.features.provenance.domain.AggregatedPathRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAggregatedPathRepository extends JpaRepository<AggregatedPath, Long>, AggregatedPathRepository {
    
    @Override
    @Query("SELECT COUNT(DISTINCT a.keptPhotoId) FROM AggregatedPath a")
    long countKeptPhotos();
}
