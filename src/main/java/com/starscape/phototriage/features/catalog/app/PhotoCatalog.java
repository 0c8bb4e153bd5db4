package com.starscape.phototriage.features.catalog.app;

import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.catalog.domain.PhotoPath;
import com.starscape.phototriage.features.catalog.domain.PhotoPathRepository;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Joins photos with their paths. Path lookups are batched to keep IN-lists bounded.
 */
@Component
public class PhotoCatalog {
    
    static final int BATCH_SIZE = 1000;
    
    private final PhotoRepository photoRepository;
    private final PhotoPathRepository photoPathRepository;
    
    public PhotoCatalog(PhotoRepository photoRepository, PhotoPathRepository photoPathRepository) {
        this.photoRepository = photoRepository;
        this.photoPathRepository = photoPathRepository;
    }
    
    /**
     * @return facts for the photos that exist, in id order; unknown ids are left out
     */
    public List<PhotoFacts> loadFactsById(Collection<String> photoIds) {
        List<String> ids = new ArrayList<>(new TreeSet<>(photoIds));
        List<Photo> photos = new ArrayList<>(ids.size());
        for (int start = 0; start < ids.size(); start += BATCH_SIZE) {
            photos.addAll(photoRepository.findAllById(ids.subList(start, Math.min(start + BATCH_SIZE, ids.size()))));
        }
        photos.sort(Comparator.comparing(Photo::getPhotoId));
        return loadFacts(photos);
    }
    
    /**
     * @return one {@link PhotoFacts} per photo, in the order given
     */
    public List<PhotoFacts> loadFacts(List<Photo> photos) {
        Map<String, List<PhotoPath>> pathsByPhoto = new HashMap<>();
        for (int start = 0; start < photos.size(); start += BATCH_SIZE) {
            List<String> batch = photos.subList(start, Math.min(start + BATCH_SIZE, photos.size()))
                .stream()
                .map(Photo::getPhotoId)
                .toList();
            for (PhotoPath path : photoPathRepository.findByPhotoIdInOrderByPathIdAsc(batch)) {
                pathsByPhoto.computeIfAbsent(path.getPhotoId(), id -> new ArrayList<>()).add(path);
            }
        }
        
        List<PhotoFacts> facts = new ArrayList<>(photos.size());
        for (Photo photo : photos) {
            facts.add(new PhotoFacts(photo, pathsByPhoto.getOrDefault(photo.getPhotoId(), List.of())));
        }
        return facts;
    }
}
