package com.starscape.phototriage.features.catalog.infra;

import com.starscape.phototriage.features.catalog.domain.PhotoPath;
import com.starscape.phototriage.features.catalog.domain.PhotoPathRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaPhotoPathRepository extends JpaRepository<PhotoPath, Long>, PhotoPathRepository {
}
