package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.features.catalog.domain.PhotoPathRepository;
import com.starscape.phototriage.features.catalog.domain.PhotoRepository;
import com.starscape.phototriage.features.classify.domain.IndividualDecisionRepository;
import com.starscape.phototriage.features.grouping.domain.DuplicateGroupRepository;
import com.starscape.phototriage.features.grouprules.domain.GroupRejectionRepository;
import com.starscape.phototriage.features.grouprules.domain.RuleCount;
import com.starscape.phototriage.features.pipeline.api.dto.CheckpointItem;
import com.starscape.phototriage.features.pipeline.api.dto.DecisionCountItem;
import com.starscape.phototriage.features.pipeline.api.dto.PipelineStatusResponse;
import com.starscape.phototriage.features.pipeline.domain.PipelineRunRepository;
import com.starscape.phototriage.features.pipeline.domain.StageCheckpointRepository;
import com.starscape.phototriage.features.provenance.domain.AggregatedPathRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts per decision and rule across the whole catalog, plus checkpoints and the latest run.
 */
@Service
public class GetPipelineStatusHandler {
    
    private final PhotoRepository photoRepository;
    private final PhotoPathRepository photoPathRepository;
    private final IndividualDecisionRepository decisionRepository;
    private final DuplicateGroupRepository groupRepository;
    private final GroupRejectionRepository rejectionRepository;
    private final AggregatedPathRepository aggregatedPathRepository;
    private final StageCheckpointRepository checkpointRepository;
    private final PipelineRunRepository runRepository;
    
    public GetPipelineStatusHandler(
            PhotoRepository photoRepository,
            PhotoPathRepository photoPathRepository,
            IndividualDecisionRepository decisionRepository,
            DuplicateGroupRepository groupRepository,
            GroupRejectionRepository rejectionRepository,
            AggregatedPathRepository aggregatedPathRepository,
            StageCheckpointRepository checkpointRepository,
            PipelineRunRepository runRepository) {
        this.photoRepository = photoRepository;
        this.photoPathRepository = photoPathRepository;
        this.decisionRepository = decisionRepository;
        this.groupRepository = groupRepository;
        this.rejectionRepository = rejectionRepository;
        this.aggregatedPathRepository = aggregatedPathRepository;
        this.checkpointRepository = checkpointRepository;
        this.runRepository = runRepository;
    }
    
    @Transactional(readOnly = true)
    public PipelineStatusResponse handle() {
        long totalPhotos = photoRepository.count();
        
        List<DecisionCountItem> decisions = decisionRepository.countByDecisionAndRule().stream()
            .map(c -> new DecisionCountItem(c.decision().name(), c.ruleName(), c.count()))
            .toList();
        long decided = decisions.stream().mapToLong(DecisionCountItem::count).sum();
        
        Map<String, Long> rejectionsByRule = new LinkedHashMap<>();
        for (RuleCount count : rejectionRepository.countByRule()) {
            rejectionsByRule.put(count.ruleName(), count.count());
        }
        long groupRejected = rejectionsByRule.values().stream().mapToLong(Long::longValue).sum();
        
        List<CheckpointItem> checkpoints = checkpointRepository.findAllByOrderByStageAsc().stream()
            .map(c -> new CheckpointItem(
                c.getStage().name(), c.getRunId(), c.getProcessedCount(), c.getNotes(), c.getCompletedAt()))
            .toList();
        
        return new PipelineStatusResponse(
            totalPhotos,
            photoPathRepository.count(),
            photoRepository.countByPrimaryHashIsNotNull(),
            decisions,
            groupRepository.countGroups(),
            groupRepository.count(),
            rejectionsByRule,
            aggregatedPathRepository.count(),
            aggregatedPathRepository.countKeptPhotos(),
            totalPhotos - decided - groupRejected,
            checkpoints,
            runRepository.findFirstByOrderByStartedAtDesc().map(PipelineRunMapper::toResponse).orElse(null)
        );
    }
}
