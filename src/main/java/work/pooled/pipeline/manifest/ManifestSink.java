package work.pooled.pipeline.manifest;

import java.nio.file.Path;
import work.pooled.pipeline.model.GroupKey;

/**
 * Boundary through which generated manifests, file lists and combined manifests leave the core.
 */
public interface ManifestSink {
    /** Working directory of the task for {@code key} in stage {@code stageId}. */
    Path taskDirectory(String stageId, GroupKey key);

    Path writeManifest(String stageId, Manifest manifest);

    Path writeFileList(String stageId, GroupKey key, StagingPlan staging);

    Path writeCombined(String stageId, CombinedManifest combined);
}
