package com.framegate.infrastructure.export;

import com.framegate.domain.frame.exception.PackagingException;
import com.framegate.domain.frame.exception.StateStoreException;
import com.framegate.domain.frame.model.AtlasAssertion;
import com.framegate.domain.frame.model.AtlasFrame;
import com.framegate.domain.frame.model.AtlasValidationReport;
import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.PackedAtlas;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.service.PackerAdapter;
import com.framegate.domain.frame.service.ValidatorAdapter;
import com.framegate.infrastructure.imaging.DecodedImage;
import com.framegate.infrastructure.imaging.ImageCodec;
import com.framegate.infrastructure.persistence.RunStateStore;
import com.framegate.infrastructure.persistence.RunWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Packs and validates the approved frames of a fully approved run, then sets its release status.
 * Packaging and storage failures are logged and leave the release status untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AtlasExportService {

    private final PackerAdapter packer;
    private final ValidatorAdapter validator;
    private final ReleaseService releaseService;
    private final ImageCodec imageCodec;
    private final RunStateStore stateStore;

    /**
     * @return true when an atlas was packed and validated
     */
    public boolean export(RunState state, RunWorkspace workspace, boolean override) {
        try {
            List<AtlasFrame> frames = loadApprovedFrames(state, workspace);
            PackedAtlas atlas = packer.pack(frames);
            stateStore.writeAtomically(workspace.atlasImagePath(), imageCodec.encodePng(atlas.image()));
            stateStore.writeJson(workspace.atlasDataPath(), atlas.frames());

            AtlasValidationReport report = validator.validate(atlas, EnumSet.allOf(AtlasAssertion.class));
            stateStore.writeJson(workspace.validationPath(), report);
            releaseService.apply(state, report, override);
            return true;
        } catch (PackagingException e) {
            log.error("[Export] Packaging failed for run {}; approved frames are kept", state.getRunId(), e);
            return false;
        } catch (RuntimeException e) {
            log.error("[Export] Export of run {} aborted; approved frames are kept", state.getRunId(), e);
            return false;
        }
    }

    private List<AtlasFrame> loadApprovedFrames(RunState state, RunWorkspace workspace) {
        List<AtlasFrame> frames = new ArrayList<>();
        for (FrameState frame : state.getFrames()) {
            Path path = workspace.approvedPath(state.getMoveId(), frame.getIndex());
            byte[] bytes;
            try {
                bytes = stateStore.readBytes(path);
            } catch (StateStoreException e) {
                throw new PackagingException("Approved frame is missing: " + path, e);
            }
            DecodedImage decoded = imageCodec.decode(bytes)
                    .orElseThrow(() -> new PackagingException("Approved frame is unreadable: " + path));
            frames.add(new AtlasFrame(FrameNaming.frameKey(state.getMoveId(), frame.getIndex()), decoded.pixels()));
        }
        return frames;
    }
}
