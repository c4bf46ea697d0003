package work.pooled.pipeline.plan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.pooled.pipeline.error.PipelineException;
import work.pooled.pipeline.error.TaskInvocationException;
import work.pooled.pipeline.gate.GateController;
import work.pooled.pipeline.grouping.Group;
import work.pooled.pipeline.manifest.FileSystemManifestSink;
import work.pooled.pipeline.manifest.Manifest;
import work.pooled.pipeline.manifest.ManifestCombiner;
import work.pooled.pipeline.manifest.ManifestOptions;
import work.pooled.pipeline.manifest.ManifestSink;
import work.pooled.pipeline.manifest.ManifestWarning;
import work.pooled.pipeline.model.Field;
import work.pooled.pipeline.model.GroupKey;
import work.pooled.pipeline.model.ImageRecord;
import work.pooled.pipeline.task.InputStager;
import work.pooled.pipeline.task.TaskCache;
import work.pooled.pipeline.task.TaskInvokerRegistry;
import work.pooled.pipeline.task.TaskRequest;
import work.pooled.pipeline.task.TaskResult;

/**
 * Runs the stage graph over a set of ingested records.
 *
 * <p>The gate schedule is fixed before any stage is grouped. Each scheduled stage is planned on
 * the calling thread, its manifests written through the {@link ManifestSink}, then its tasks run
 * in a bounded pool; outcomes are collected back in key order. A failed group only removes its
 * own outputs from downstream stages.
 */
public final class PipelineExecutor {
    static final String INPUT_DIR = "input";
    static final String OUTPUT_DIR = "output";

    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);

    private final GateController gates;
    private final StagePlanner planner;
    private final OutputRetagger retagger;
    private final ManifestSink sink;
    private final TaskInvokerRegistry invokers;
    private final TaskCache cache;
    private final InputStager stager;

    public PipelineExecutor(ManifestSink sink, TaskInvokerRegistry invokers) {
        this(new GateController(), new StagePlanner(), new OutputRetagger(), sink, invokers, new TaskCache(), new InputStager());
    }

    public PipelineExecutor(
        GateController gates,
        StagePlanner planner,
        OutputRetagger retagger,
        ManifestSink sink,
        TaskInvokerRegistry invokers,
        TaskCache cache,
        InputStager stager
    ) {
        this.gates = gates;
        this.planner = planner;
        this.retagger = retagger;
        this.sink = sink;
        this.invokers = invokers;
        this.cache = cache;
        this.stager = stager;
    }

    public PipelineReport execute(Collection<ImageRecord> records, PipelineSettings settings) {
        var schedule = gates.schedule(settings.gates(), List.of(PipelineStage.values()));
        Map<PipelineStage, List<Group>> produced = new EnumMap<>(PipelineStage.class);
        Map<PipelineStage, Set<GroupKey>> failed = new EnumMap<>(PipelineStage.class);
        var reports = new ArrayList<StageReport>();

        for (PipelineStage stage : PipelineStage.values()) {
            if (!schedule.isScheduled(stage)) {
                reports.add(StageReport.deferred(stage, schedule.awaiting(stage)));
                continue;
            }
            if (settings.planOnly() && !stage.upstream().isEmpty()) {
                logger.info("Stage {} needs upstream outputs; not planned without running", stage.id());
                reports.add(new StageReport(stage, true, Set.of(), 0, List.of(), List.of(), List.of(), List.of()));
                continue;
            }
            var inputs = inputsFor(stage, records, produced);
            var coarse = stage.joinStage().map(join -> produced.getOrDefault(join, List.of())).orElse(List.of());
            var failedUpstream = failedLineage(stage, failed);
            var options = stage.stageType().map(settings::manifestOptions).orElse(ManifestOptions.DEFAULT);
            var plan = planner.plan(stage, inputs, coarse, failedUpstream, options);

            var manifestPaths = writeManifests(stage, plan);
            var outcomes = settings.planOnly()
                ? plan.tasks().stream().map(task -> TaskOutcome.planned(task.key())).toList()
                : runTasks(plan, manifestPaths, settings);

            var outputs = new ArrayList<Group>();
            var failedKeys = new HashSet<GroupKey>();
            for (PipelineException failure : plan.failures()) {
                failure.groupKey().ifPresent(failedKeys::add);
            }
            failedKeys.addAll(plan.skipped());
            failedKeys.addAll(failedUpstream);
            for (TaskOutcome outcome : outcomes) {
                if (outcome.failed()) {
                    failedKeys.add(outcome.key());
                } else if (!outcome.outputs().isEmpty()) {
                    outputs.add(new Group(outcome.key(), retagger.retag(outcome.key(), outcome.outputs())));
                }
            }
            produced.put(stage, outputs);
            failed.put(stage, failedKeys);

            var warnings = new ArrayList<ManifestWarning>();
            plan.tasks().forEach(task -> task.manifest().ifPresent(m -> warnings.addAll(m.warnings())));
            reports.add(new StageReport(
                stage, true, Set.of(), plan.inputRecords(), outcomes, plan.failures(), plan.skipped(), warnings
            ));
        }
        return new PipelineReport(settings.gates(), reports);
    }

    /** Failed keys of every upstream stage, cut down to the fields {@code stage} groups by. */
    private static Set<GroupKey> failedLineage(PipelineStage stage, Map<PipelineStage, Set<GroupKey>> failed) {
        var lineage = new HashSet<GroupKey>();
        for (PipelineStage upstream : stage.upstream()) {
            for (GroupKey key : failed.getOrDefault(upstream, Set.of())) {
                var shared = key.fields().stream().filter(stage.keyFields()::contains).toList();
                if (!shared.isEmpty()) {
                    lineage.add(key.project(shared));
                }
            }
        }
        return lineage;
    }

    private static List<ImageRecord> inputsFor(
        PipelineStage stage,
        Collection<ImageRecord> records,
        Map<PipelineStage, List<Group>> produced
    ) {
        var inputs = new ArrayList<ImageRecord>();
        if (stage.readsIngestedRecords()) {
            for (ImageRecord record : records) {
                if (record.arm().map(stage.arms()::contains).orElse(false)) {
                    inputs.add(record);
                }
            }
            return inputs;
        }
        for (PipelineStage upstream : stage.inputs()) {
            produced.getOrDefault(upstream, List.of()).forEach(group -> inputs.addAll(group.members()));
        }
        return inputs;
    }

    private Map<GroupKey, Optional<Path>> writeManifests(PipelineStage stage, StagePlan plan) {
        var paths = new HashMap<GroupKey, Optional<Path>>();
        var manifests = new ArrayList<Manifest>();
        for (PlannedTask task : plan.tasks()) {
            var path = task.manifest().map(manifest -> sink.writeManifest(stage.id(), manifest));
            sink.writeFileList(stage.id(), task.key(), task.staging());
            task.manifest().ifPresent(manifests::add);
            paths.put(task.key(), path);
        }
        if (!manifests.isEmpty() && stage.keyFields().contains(Field.WELL)) {
            var byFields = new ArrayList<>(stage.keyFields());
            byFields.remove(Field.WELL);
            for (var combined : new ManifestCombiner(stage.id()).combine(manifests, byFields)) {
                sink.writeCombined(stage.id(), combined);
            }
        }
        return paths;
    }

    private List<TaskOutcome> runTasks(StagePlan plan, Map<GroupKey, Optional<Path>> manifestPaths, PipelineSettings settings) {
        if (plan.tasks().isEmpty()) {
            return List.of();
        }
        int threads = Math.min(settings.parallelism(), plan.tasks().size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            var futures = new ArrayList<Future<TaskOutcome>>(plan.tasks().size());
            for (PlannedTask task : plan.tasks()) {
                futures.add(pool.submit(() -> runTask(task, manifestPaths.getOrDefault(task.key(), Optional.empty()), settings)));
            }
            var outcomes = new ArrayList<TaskOutcome>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                var key = plan.tasks().get(i).key();
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    outcomes.add(TaskOutcome.failed(key, new TaskInvocationException(
                        "Unexpected failure: " + ex.getCause(), key, ex.getCause()
                    )));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    outcomes.add(TaskOutcome.failed(key, new TaskInvocationException("Interrupted", key, ex)));
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private TaskOutcome runTask(PlannedTask task, Optional<Path> manifest, PipelineSettings settings) {
        var stage = task.stage();
        var key = task.key();
        var taskDirectory = sink.taskDirectory(stage.id(), key);
        var taskSettings = settings.taskSettings(stage);
        try {
            var digest = task.digest(taskSettings);
            if (settings.resume()) {
                var hit = cache.lookup(taskDirectory, digest);
                if (hit.isPresent()) {
                    logger.info("[{}] {} reused from cache", key, stage.id());
                    return TaskOutcome.succeeded(key, hit.get().outputs(), true);
                }
            }
            var inputDirectory = taskDirectory.resolve(INPUT_DIR);
            stager.stage(inputDirectory, task.staging().placements());
            var request = new TaskRequest(
                stage.id(),
                key,
                taskDirectory,
                inputDirectory,
                manifest,
                taskDirectory.resolve(FileSystemManifestSink.FILE_LIST_FILE),
                taskSettings.config(),
                taskDirectory.resolve(OUTPUT_DIR),
                stage.outputGlob(),
                taskSettings.command(),
                taskSettings.timeout()
            );
            TaskResult result = invokers.resolve(stage.id()).invoke(request).requireSuccess(request);
            cache.store(taskDirectory, digest, result);
            return TaskOutcome.succeeded(key, result.outputs(), false);
        } catch (PipelineException ex) {
            logger.error("{}", ex.getMessage());
            return TaskOutcome.failed(key, ex);
        } catch (RuntimeException ex) {
            logger.error("[{}] {} failed: {}", key, stage.id(), ex.toString());
            return TaskOutcome.failed(key, new TaskInvocationException(String.valueOf(ex.getMessage()), key, ex));
        }
    }
}
