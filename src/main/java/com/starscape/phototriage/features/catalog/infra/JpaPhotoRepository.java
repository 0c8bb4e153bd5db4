package com.starscape.phototriage.features.catalog.infra;

import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaPhotoRepository extends JpaRepository<Photo, String>, PhotoRepository {
    
    @Override
    @Query("SELECT p FROM Photo p WHERE NOT EXISTS " +
           "(SELECT d FROM IndividualDecision d WHERE d.photoId = p.photoId) " +
           "ORDER BY p.photoId")
    List<Photo> findUndecided();
    
    @Override
    @Query("SELECT p FROM Photo p WHERE p.primaryHash IS NOT NULL AND NOT EXISTS " +
           "(SELECT d FROM IndividualDecision d WHERE d.photoId = p.photoId) " +
           "ORDER BY p.photoId")
    List<Photo> findGroupingCandidates();
}
