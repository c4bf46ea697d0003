package work.pooled.pipeline.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.pooled.pipeline.support.PipelineTestSupport.screen;
import static work.pooled.pipeline.support.PipelineTestSupport.writeTable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pooled.pipeline.model.Arm;
import work.pooled.pipeline.plan.PipelineStage;
import work.pooled.pipeline.support.ScriptedTaskInvoker;
import work.pooled.pipeline.task.TaskInvokerRegistry;

class PipelineRunnerTest {
    @TempDir
    Path root;

    private PipelineRunConfiguration.Builder configuration() {
        var table = writeTable(root.resolve("samples.csv"), screen(root.resolve("raw")));
        return PipelineRunConfiguration.builder()
            .input(table)
            .outputDirectory(root.resolve("results"))
            .parallelism(2);
    }

    @Test
    void fullRunSucceeds() {
        var invoker = new ScriptedTaskInvoker();
        var runner = new PipelineRunner(new TaskInvokerRegistry(invoker));

        var result = runner.run(configuration().commit(Arm.PAINTING).commit(Arm.BARCODING).build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(0, result.status().exitCode());
        assertEquals(12, result.metadata().get("records"));
        assertEquals(0, result.metadata().get("failures"));
        assertEquals(2, invoker.calls(PipelineStage.COMBINED_ANALYSIS));
        assertTrue(Files.isDirectory(root.resolve("results/combined_analysis")));
    }

    @Test
    void failingTasksMakeTheRunPartial() {
        var invoker = new ScriptedTaskInvoker()
            .failWhen(request -> request.stageId().equals(PipelineStage.BARCODING_PREPROCESS.id()));
        var runner = new PipelineRunner(new TaskInvokerRegistry(invoker));

        var result = runner.run(configuration().commit(Arm.PAINTING).commit(Arm.BARCODING).build());

        assertEquals(RunResult.Status.PARTIAL, result.status());
        assertEquals(2, result.status().exitCode());
        assertEquals(0, invoker.calls(PipelineStage.BARCODING_STITCH_CROP));
        assertEquals(0, invoker.calls(PipelineStage.COMBINED_ANALYSIS));
    }

    @Test
    void planOnlyInvokesNothing() {
        var invoker = new ScriptedTaskInvoker();
        var runner = new PipelineRunner(new TaskInvokerRegistry(invoker));

        var result = runner.run(configuration().planOnly(true).build());

        assertEquals(RunResult.Status.PLANNED, result.status());
        assertEquals(0, invoker.totalCalls());
        assertTrue(result.toPrettyJson().contains("\"planned\""));
    }

    @Test
    void missingTableFailsWithAnErrorReport() {
        var runner = new PipelineRunner(new TaskInvokerRegistry(new ScriptedTaskInvoker()));

        var result = runner.run(PipelineRunConfiguration.builder()
            .input(root.resolve("absent.csv"))
            .outputDirectory(root.resolve("results"))
            .build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        @SuppressWarnings("unchecked")
        var error = (Map<String, Object>) result.metadata().get("error");
        assertEquals("invalid_configuration", error.get("code"));
    }
}
