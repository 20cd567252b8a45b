package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.NormalizedFrame;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.RunManifest;
import com.framegate.domain.frame.model.RunState;
import com.framegate.infrastructure.audit.AuditContext;
import com.framegate.infrastructure.imaging.AnchorReference;
import com.framegate.infrastructure.persistence.RunWorkspace;
import lombok.Data;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable context carrying run-level data through the orchestrator stages.
 */
@Data
public class RunContext {

    // Input
    private RunManifest manifest;
    private PipelineSettings settings;
    private RunWorkspace workspace;
    private CancellationToken token;
    private boolean overrideFingerprint;

    // Anchor, resolved once
    private byte[] anchorBytes;
    private AnchorReference anchor;
    private PixelBuffer auditAnchor;
    private AlignmentTarget auditTarget;
    private List<Integer> palette;
    private AuditContext auditContext;
    private String fingerprint;

    // Progress
    private RunState state;
    private NormalizedFrame lastCandidate;
    private PixelBuffer lastApproved;
    private Map<Integer, PixelBuffer> approvedImages = new HashMap<>();

    public AlignmentTarget alignmentTarget() {
        return anchor.target();
    }
}
