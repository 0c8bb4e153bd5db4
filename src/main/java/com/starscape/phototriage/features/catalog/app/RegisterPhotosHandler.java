package com.starscape.phototriage.features.catalog.app;

import com.starscape.phototriage.features.catalog.api.dto.PhotoRegistration;
import com.starscape.phototriage.features.catalog.api.dto.RegisterPhotosRequest;
import com.starscape.phototriage.features.catalog.api.dto.RegisterPhotosResponse;
import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoPath;
import com.starscape.phototriage.features.catalog.domain.PhotoPathRepository;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Records photos and the paths they were found at, as reported by the external scanner.
 * Registering the same content again only appends paths not seen before.
 */
@Service
public class RegisterPhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(RegisterPhotosHandler.class);
    
    private final PhotoRepository photoRepository;
    private final PhotoPathRepository photoPathRepository;
    
    public RegisterPhotosHandler(PhotoRepository photoRepository, PhotoPathRepository photoPathRepository) {
        this.photoRepository = photoRepository;
        this.photoPathRepository = photoPathRepository;
    }
    
    @Transactional
    public RegisterPhotosResponse handle(RegisterPhotosRequest request) {
        Set<String> ids = new LinkedHashSet<>();
        for (PhotoRegistration registration : request.photos()) {
            ids.add(registration.photoId().toLowerCase(Locale.ROOT));
        }
        Set<String> known = new HashSet<>();
        photoRepository.findAllById(ids).forEach(photo -> known.add(photo.getPhotoId()));
        
        int created = 0;
        int existing = 0;
        int pathsAdded = 0;
        List<Photo> newPhotos = new ArrayList<>();
        List<PhotoPath> newPaths = new ArrayList<>();
        Set<String> seenPaths = new HashSet<>();
        
        for (PhotoRegistration registration : request.photos()) {
            String photoId = registration.photoId().toLowerCase(Locale.ROOT);
            if (known.add(photoId)) {
                newPhotos.add(new Photo(
                    photoId,
                    registration.mimeType(),
                    registration.bytes(),
                    registration.width(),
                    registration.height(),
                    registration.capturedAt(),
                    registration.dateSource(),
                    registration.hasExif()
                ));
                created++;
            } else {
                existing++;
            }
            
            for (String sourcePath : registration.sourcePaths()) {
                if (!seenPaths.add(photoId + "\n" + sourcePath)) {
                    continue;
                }
                if (photoPathRepository.existsByPhotoIdAndSourcePath(photoId, sourcePath)) {
                    continue;
                }
                newPaths.add(new PhotoPath(photoId, sourcePath));
                pathsAdded++;
            }
        }
        
        photoRepository.saveAll(newPhotos);
        photoPathRepository.saveAll(newPaths);
        
        log.info("Registered photos: created={}, existing={}, pathsAdded={}", created, existing, pathsAdded);
        return new RegisterPhotosResponse(created, existing, pathsAdded);
    }
}
