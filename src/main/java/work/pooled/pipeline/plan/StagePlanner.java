package work.pooled.pipeline.plan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.ManifestException;
import work.pooled.pipeline.error.PipelineException;
import work.pooled.pipeline.grouping.Group;
import work.pooled.pipeline.grouping.GroupingEngine;
import work.pooled.pipeline.join.JoinEngine;
import work.pooled.pipeline.join.JoinedGroup;
import work.pooled.pipeline.join.KeyProjection;
import work.pooled.pipeline.manifest.ManifestGenerator;
import work.pooled.pipeline.manifest.ManifestOptions;
import work.pooled.pipeline.manifest.StagingPlan;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;

/**
 * Groups, joins and renders manifests for one stage. Pure: nothing is written or run.
 */
public final class StagePlanner {
    private static final Logger logger = LoggerFactory.getLogger(StagePlanner.class);

    private final GroupingEngine grouping;
    private final JoinEngine joins;
    private final ManifestGenerator manifests;

    public StagePlanner() {
        this(new GroupingEngine(), new JoinEngine(), new ManifestGenerator());
    }

    public StagePlanner(GroupingEngine grouping, JoinEngine joins, ManifestGenerator manifests) {
        this.grouping = grouping;
        this.joins = joins;
        this.manifests = manifests;
    }

    /**
     * @param coarse         outputs of the stage's join stage, ignored when it has none
     * @param failedUpstream keys of failed upstream groups, restricted to fields this stage groups by;
     *                       groups whose key extends one of them are skipped
     */
    public StagePlan plan(
        PipelineStage stage,
        Collection<ImageRecord> inputs,
        List<Group> coarse,
        Set<GroupKey> failedUpstream,
        ManifestOptions options
    ) {
        var failures = new ArrayList<PipelineException>();
        var skipped = new ArrayList<GroupKey>();
        var grouped = grouping.partition(inputs, stage.keyFields());
        failures.addAll(grouped.failures());

        var eligible = new ArrayList<Group>(grouped.groups().size());
        for (Group group : grouped.groups()) {
            var ancestor = failedAncestor(group.key(), failedUpstream);
            if (ancestor.isPresent()) {
                logger.warn("[{}] skipped: upstream group {} failed", group.key(), ancestor.get());
                skipped.add(group.key());
            } else {
                eligible.add(group);
            }
        }

        List<JoinedGroup> joined;
        var joinStage = stage.joinStage();
        if (joinStage.isPresent()) {
            var result = joins.join(eligible, coarse, new KeyProjection(joinStage.get().keyFields()));
            failures.addAll(result.failures());
            joined = result.joined();
        } else {
            joined = eligible.stream().map(JoinedGroup::standalone).toList();
        }

        var tasks = new ArrayList<PlannedTask>(joined.size());
        for (JoinedGroup group : joined) {
            try {
                var manifest = stage.stageType().map(type -> manifests.generate(group, type, options));
                var staging = manifest.isPresent()
                    ? manifest.get().staging()
                    : StagingPlan.of(group, false);
                tasks.add(new PlannedTask(stage, group, manifest, staging));
            } catch (ManifestException ex) {
                var keyed = ex.withGroupKey(group.key());
                logger.warn("{}", keyed.getMessage());
                failures.add(keyed);
            }
        }
        logger.info(
            "Stage {}: {} record(s) into {} group(s), {} task(s) planned, {} failed, {} skipped",
            stage.id(), inputs.size(), grouped.groups().size(), tasks.size(), failures.size(), skipped.size()
        );
        return new StagePlan(stage, inputs.size(), tasks, failures, skipped);
    }

    private static Optional<GroupKey> failedAncestor(GroupKey key, Set<GroupKey> failedUpstream) {
        for (GroupKey failed : failedUpstream) {
            if (key.fields().containsAll(failed.fields()) && key.project(failed.fields()).equals(failed)) {
                return Optional.of(failed);
            }
        }
        return Optional.empty();
    }

    public StagePlan plan(PipelineStage stage, Collection<ImageRecord> inputs) {
        return plan(stage, inputs, List.of(), Set.of(), ManifestOptions.DEFAULT);
    }
}
