package com.starscape.phototriage.features.classify.app;

import com.starscape.phototriage.common.exception.InvariantViolationException;
import com.starscape.phototriage.features.catalog.app.PhotoCatalog;
import com.starscape.phototriage.features.catalog.domain.Photo;
import com.starscape.phototriage.features.catalog.domain.PhotoFacts;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import com.starscape.phototriage.features.classify.domain.Decision;
import com.starscape.phototriage.features.classify.domain.IndividualDecision;
import com.starscape.phototriage.features.classify.domain.IndividualDecisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Classification stage: runs the individual rules over every photo that has no decision yet and
 * stores the verdicts in one transaction.
 */
@Service
public class ClassifyPhotosHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ClassifyPhotosHandler.class);
    
    private final PhotoRepository photoRepository;
    private final IndividualDecisionRepository decisionRepository;
    private final PhotoCatalog photoCatalog;
    private final IndividualClassifier classifier;
    
    public ClassifyPhotosHandler(
            PhotoRepository photoRepository,
            IndividualDecisionRepository decisionRepository,
            PhotoCatalog photoCatalog,
            IndividualClassifier classifier) {
        this.photoRepository = photoRepository;
        this.decisionRepository = decisionRepository;
        this.photoCatalog = photoCatalog;
        this.classifier = classifier;
    }
    
    /**
     * @param runId run the decisions are attributed to
     * @param reclassify drop all existing decisions first and classify from scratch
     */
    @Transactional
    public ClassificationSummary handle(String runId, boolean reclassify) {
        if (reclassify) {
            log.info("Clearing {} individual decisions before reclassification", decisionRepository.count());
            decisionRepository.deleteAllInBatch();
        }
        
        List<Photo> undecided = photoRepository.findUndecided();
        List<PhotoFacts> facts = photoCatalog.loadFacts(undecided);
        log.debug("Classifying {} undecided photos", facts.size());
        
        List<IndividualDecision> decisions = new ArrayList<>();
        Map<String, Integer> byRule = new TreeMap<>();
        int rejected = 0;
        int separated = 0;
        
        for (PhotoFacts photo : facts) {
            Optional<Classification> result = classifier.classify(photo);
            if (result.isEmpty()) {
                continue;
            }
            Classification classification = result.get();
            decisions.add(new IndividualDecision(
                photo.photoId(), classification.decision(), classification.ruleName(), runId));
            byRule.merge(classification.ruleName(), 1, Integer::sum);
            if (classification.decision() == Decision.REJECT) {
                rejected++;
            } else {
                separated++;
            }
        }
        
        decisionRepository.saveAll(withoutDuplicates(decisions));
        
        ClassificationSummary summary = new ClassificationSummary(
            facts.size(), rejected, separated, facts.size() - rejected - separated, byRule);
        log.info("Classification complete: examined={}, rejected={}, separated={}, accepted={}",
            summary.examined(), summary.rejected(), summary.separated(), summary.accepted());
        return summary;
    }
    
    /**
     * Drops decisions already on record with the same verdict; a different verdict for a decided
     * photo is a double decision.
     */
    private List<IndividualDecision> withoutDuplicates(List<IndividualDecision> decisions) {
        if (decisions.isEmpty()) {
            return decisions;
        }
        Map<String, IndividualDecision> existing = decisionRepository.findAllById(
                decisions.stream().map(IndividualDecision::getPhotoId).toList())
            .stream()
            .collect(Collectors.toMap(IndividualDecision::getPhotoId, Function.identity()));
        
        List<IndividualDecision> fresh = new ArrayList<>(decisions.size());
        for (IndividualDecision decision : decisions) {
            IndividualDecision recorded = existing.get(decision.getPhotoId());
            if (recorded == null) {
                fresh.add(decision);
            } else if (!recorded.sameVerdictAs(decision.getDecision(), decision.getRuleName())) {
                throw InvariantViolationException.forPhoto(
                    "Photo already decided " + recorded.getDecision() + "/" + recorded.getRuleName()
                        + ", refusing " + decision.getDecision() + "/" + decision.getRuleName(),
                    decision.getPhotoId());
            }
        }
        return fresh;
    }
}
