package com.starscape.phototriage.features.grouping.app;

import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import com.starscape.phototriage.features.grouping.domain.DuplicateGroupMember;
import com.starscape.phototriage.features.grouping.domain.DuplicateGroupRepository;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Grouping stage: rebuilds duplicate-group membership from scratch over every undecided, hashed
 * photo. Clearing and rewriting happen in one transaction.
 */
@Service
public class GroupPhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GroupPhotosHandler.class);
    
    private final PhotoRepository photoRepository;
    private final DuplicateGroupRepository groupRepository;
    private final SimilarityGrouper grouper;
    
    public GroupPhotosHandler(
            PhotoRepository photoRepository,
            DuplicateGroupRepository groupRepository,
            SimilarityGrouper grouper) {
        this.photoRepository = photoRepository;
        this.groupRepository = groupRepository;
        this.grouper = grouper;
    }
    
    @Transactional
    public GroupingResult handle(String runId, LinkageMode linkage) {
        List<Photo> photos = photoRepository.findGroupingCandidates();
        List<HashedPhoto> candidates = new ArrayList<>(photos.size());
        for (Photo photo : photos) {
            candidates.add(new HashedPhoto(photo.getPhotoId(), photo.primary(), photo.secondary()));
        }
        log.debug("Grouping {} hashed candidates", candidates.size());
        
        GroupingResult result = grouper.group(candidates, linkage);
        
        groupRepository.deleteAllInBatch();
        List<DuplicateGroupMember> members = new ArrayList<>(result.groupedPhotos());
        for (DuplicateGroup group : result.groups()) {
            for (String photoId : group.photoIds()) {
                members.add(new DuplicateGroupMember(photoId, group.groupId(), runId));
            }
        }
        groupRepository.saveAll(members);
        
        return result;
    }
}
