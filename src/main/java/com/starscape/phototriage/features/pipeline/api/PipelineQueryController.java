package com.starscape.phototriage.features.pipeline.api;

import com.starscape.phototriage.features.pipeline.api.dto.PipelineRunResponse;
import com.starscape.phototriage.features.pipeline.api.dto.PipelineStatusResponse;
import com.starscape.phototriage.features.pipeline.api.dto.RunEventItem;
import com.starscape.phototriage.features.pipeline.app.GetPipelineRunHandler;
import com.starscape.phototriage.features.pipeline.app.GetPipelineStatusHandler;
import com.starscape.phototriage.features.pipeline.app.GetRunEventsHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/queries/pipeline")
public class PipelineQueryController {
    
    private final GetPipelineRunHandler getPipelineRunHandler;
    private final GetPipelineStatusHandler getPipelineStatusHandler;
    private final GetRunEventsHandler getRunEventsHandler;
    
    public PipelineQueryController(
            GetPipelineRunHandler getPipelineRunHandler,
            GetPipelineStatusHandler getPipelineStatusHandler,
            GetRunEventsHandler getRunEventsHandler) {
        this.getPipelineRunHandler = getPipelineRunHandler;
        this.getPipelineStatusHandler = getPipelineStatusHandler;
        this.getRunEventsHandler = getRunEventsHandler;
    }
    
    @GetMapping("/runs/{runId}")
    public ResponseEntity<PipelineRunResponse> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(getPipelineRunHandler.handle(runId));
    }
    
    @GetMapping("/runs/{runId}/events")
    public ResponseEntity<List<RunEventItem>> getRunEvents(@PathVariable String runId) {
        return ResponseEntity.ok(getRunEventsHandler.handle(runId));
    }
    
    @GetMapping("/status")
    public ResponseEntity<PipelineStatusResponse> getStatus() {
        return ResponseEntity.ok(getPipelineStatusHandler.handle());
    }
}
