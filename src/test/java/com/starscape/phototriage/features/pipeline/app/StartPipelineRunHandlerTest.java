package com.starscape.phototriage.features.pipeline.app;

import com.starscape.phototriage.common.config.TriageProperties;
import com.starscape.phototriage.features.grouping.domain.LinkageMode;
import com.starscape.phototriage.features.pipeline.api.dto.StartRunRequest;
import com.starscape.phototriage.features.pipeline.api.dto.StartRunResponse;
import com.starscape.phototriage.features.pipeline.domain.PipelineRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartPipelineRunHandlerTest {
    
    @Mock
    private PipelineRunTracker tracker;
    
    @Mock
    private PipelineOrchestrator orchestrator;
    
    private StartPipelineRunHandler handler;
    
    private final PipelineRun run = new PipelineRun("run_1", LinkageMode.COMPLETE, 1, 10, false);
    
    @BeforeEach
    void setUp() {
        handler = new StartPipelineRunHandler(tracker, orchestrator, new TriageProperties());
    }
    
    @Test
    @DisplayName("opens the run and hands it to the executor")
    void startsRun() {
        when(tracker.open(LinkageMode.COMPLETE, false)).thenReturn(run);
        
        StartRunResponse response = handler.handle(new StartRunRequest(LinkageMode.COMPLETE, null));
        
        assertThat(response.runId()).isEqualTo("run_1");
        assertThat(response.linkage()).isEqualTo("COMPLETE");
        verify(orchestrator).execute("run_1", LinkageMode.COMPLETE, false);
        verify(tracker, never()).fail(anyString(), anyString());
    }
    
    @Test
    @DisplayName("falls back to the configured linkage")
    void defaultsLinkage() {
        PipelineRun singleRun = new PipelineRun("run_2", LinkageMode.SINGLE, 1, 10, true);
        when(tracker.open(LinkageMode.SINGLE, true)).thenReturn(singleRun);
        
        handler.handle(new StartRunRequest(null, true));
        
        verify(orchestrator).execute("run_2", LinkageMode.SINGLE, true);
    }
    
    @Test
    @DisplayName("a run the executor refuses is failed instead of left running")
    void failsRejectedRun() {
        when(tracker.open(LinkageMode.COMPLETE, false)).thenReturn(run);
        doThrow(new TaskRejectedException("queue full"))
            .when(orchestrator).execute("run_1", LinkageMode.COMPLETE, false);
        
        assertThatThrownBy(() -> handler.handle(new StartRunRequest(LinkageMode.COMPLETE, false)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("run_1");
        
        verify(tracker).fail(eq("run_1"), startsWith("Rejected by pipeline executor"));
    }
}
