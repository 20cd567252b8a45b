package com.framegate.infrastructure.export;

import com.framegate.domain.frame.exception.StateStoreException;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.ReleaseStatus;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.RunStatus;
import com.framegate.domain.frame.service.PackerAdapter;
import com.framegate.domain.frame.service.ValidatorAdapter;
import com.framegate.infrastructure.imaging.ImageCodec;
import com.framegate.infrastructure.persistence.RunStateStore;
import com.framegate.infrastructure.persistence.RunWorkspace;
import com.framegate.support.Sprites;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AtlasExportServiceTest {

    @Mock
    private PackerAdapter packer;

    @Mock
    private ValidatorAdapter validator;

    @Mock
    private ReleaseService releaseService;

    @Mock
    private RunStateStore stateStore;

    private final ImageCodec codec = new ImageCodec();
    private final RunWorkspace workspace = RunWorkspace.of(Path.of("runs"), "run_1");

    private AtlasExportService exportService;
    private RunState state;

    @BeforeEach
    void setUp() {
        exportService = new AtlasExportService(packer, validator, releaseService, codec, stateStore);
        state = RunState.start("run_1", "idle", "fp", 2, Instant.parse("2026-01-01T00:00:00Z"));
        state.getFrames().forEach(frame -> frame.setStatus(FrameStatus.APPROVED));
        state.setStatus(RunStatus.COMPLETED);
    }

    @Test
    @DisplayName("An unexpected packer error is contained and leaves the release pending")
    void packerErrorContained() {
        when(stateStore.readBytes(any())).thenReturn(codec.encodePng(Sprites.body(16, 8, 14, 6)));
        when(packer.pack(anyList())).thenThrow(new IllegalStateException("grid overflow"));

        boolean exported = exportService.export(state, workspace, false);

        assertThat(exported).isFalse();
        assertThat(state.getReleaseStatus()).isEqualTo(ReleaseStatus.PENDING);
        assertThat(state.getStatus()).isEqualTo(RunStatus.COMPLETED);
        verifyNoInteractions(validator, releaseService);
    }

    @Test
    @DisplayName("A missing approved frame is reported as a packaging failure")
    void missingApprovedFrame() {
        when(stateStore.readBytes(any())).thenThrow(new StateStoreException("Failed to read frame"));

        boolean exported = exportService.export(state, workspace, false);

        assertThat(exported).isFalse();
        assertThat(state.getReleaseStatus()).isEqualTo(ReleaseStatus.PENDING);
        verifyNoInteractions(packer, validator, releaseService);
    }
}
