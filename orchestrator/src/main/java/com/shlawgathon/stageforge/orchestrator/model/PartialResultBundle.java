package com.shlawgathon.stageforge.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Human-diagnosable dump of run state written when a run fails. Distinct from a
 * {@link Checkpoint}, which exists for programmatic resumption.
 */
@Value
@Builder(toBuilder = true)
public class PartialResultBundle {

    @Singular
    List<StageResult> stageResults;

    PipelineError error;

    WorkingDocument workingDocument;

    RecoveryInfo recoveryInfo;

    // Null when the bundle could not be written
    Path location;
}
