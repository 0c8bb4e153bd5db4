package com.starscape.phototriage.features.pipeline.api;

import com.starscape.phototriage.features.pipeline.api.dto.StartRunRequest;
import com.starscape.phototriage.features.pipeline.api.dto.StartRunResponse;
import com.starscape.phototriage.features.pipeline.app.StartPipelineRunHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands/pipeline")
public class PipelineController {
    
    private final StartPipelineRunHandler startPipelineRunHandler;
    
    public PipelineController(StartPipelineRunHandler startPipelineRunHandler) {
        this.startPipelineRunHandler = startPipelineRunHandler;
    }
    
    /**
     * Start classify, group and group rules in the background.
     *
     * @return 202 Accepted with the run id; 409 if a run is already in progress
     */
    @PostMapping("/runs")
    public ResponseEntity<StartRunResponse> startRun(@RequestBody(required = false) StartRunRequest request) {
        StartRunResponse response = startPipelineRunHandler.handle(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
