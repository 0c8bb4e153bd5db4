package com.starscape.phototriage.features.catalog.app;

import com.starscape.phototriage.features.catalog.api.dto.HashImportItem;
import com.starscape.phototriage.features.catalog.api.dto.ImportHashesRequest;
import com.starscape.phototriage.features.catalog.api.dto.ImportHashesResponse;
import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import com.starscape.phototriage.features.hashing.domain.HashCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bulk-loads perceptual hashes computed by an earlier scan. Only empty hash fields are filled,
 * so re-importing the same file is harmless. Malformed hex fails the whole import.
 */
@Service
public class ImportPriorHashesHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ImportPriorHashesHandler.class);
    
    private final PhotoRepository photoRepository;
    
    public ImportPriorHashesHandler(PhotoRepository photoRepository) {
        this.photoRepository = photoRepository;
    }
    
    @Transactional
    public ImportHashesResponse handle(ImportHashesRequest request) {
        List<String> ids = request.hashes().stream()
            .map(item -> item.photoId().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
        Map<String, Photo> photos = photoRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(Photo::getPhotoId, Function.identity()));
        
        int imported = 0;
        int alreadyHashed = 0;
        int unknown = 0;
        List<Photo> changed = new ArrayList<>();
        
        for (HashImportItem item : request.hashes()) {
            Photo photo = photos.get(item.photoId().toLowerCase(Locale.ROOT));
            if (photo == null) {
                log.debug("Skipping hashes for unknown photo {}", item.photoId());
                unknown++;
                continue;
            }
            
            // Malformed hex fails the import even for photos that would be skipped
            HashCodec.decode(item.primaryHash());
            HashCodec.decode(item.secondaryHash());
            
            String primary = photo.hasPrimaryHash() ? null : item.primaryHash();
            String secondary = photo.hasSecondaryHash() ? null : item.secondaryHash();
            if (photo.assignHashes(primary, secondary)) {
                changed.add(photo);
                imported++;
            } else {
                alreadyHashed++;
            }
        }
        
        photoRepository.saveAll(changed);
        
        log.info("Imported prior hashes: imported={}, alreadyHashed={}, unknownPhotos={}",
            imported, alreadyHashed, unknown);
        return new ImportHashesResponse(imported, alreadyHashed, unknown);
    }
}
