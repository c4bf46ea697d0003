package work.pooled.pipeline.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.pooled.pipeline.api.LogLevel;
import work.pooled.pipeline.api.PipelineRunConfiguration;
import work.pooled.pipeline.api.PipelineRunner;
import work.pooled.pipeline.config.RunConfigurationLoader;
import work.pooled.pipeline.model.Arm;

@CommandLine.Command(
    name = "pooled-pipeline",
    description = "Group, join and describe pooled-screen images for the external processing tools.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PipelineCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML run configuration.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "Input table (CSV with header or JSON array); overrides run.input.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path input;

    @CommandLine.Option(
        names = {"-o", "--outdir"},
        description = "Output directory; overrides run.outdir.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outdir;

    @CommandLine.Option(names = "--qc-painting-passed", description = "Commit the painting arm's quality review.")
    private boolean paintingPassed;

    @CommandLine.Option(names = "--qc-barcoding-passed", description = "Commit the barcoding arm's quality review.")
    private boolean barcodingPassed;

    @CommandLine.Option(names = "--plan-only", description = "Write manifests and file lists without invoking tasks.")
    private boolean planOnly;

    @CommandLine.Option(names = "--resume", description = "Reuse outputs of tasks whose inputs are unchanged.")
    private boolean resume;

    @CommandLine.Option(
        names = "--parallelism",
        description = "Concurrent tasks per stage (default: available processors).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer parallelism;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        var logLevel = LogLevel.from(logLevelRaw);
        logLevel.apply();

        var builder = config != null
            ? new RunConfigurationLoader().load(config)
            : PipelineRunConfiguration.builder();
        if (input != null) {
            builder.input(input);
        }
        if (!builder.hasInput()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "An input table is required (--input or run.input).");
        }
        if (outdir != null) {
            builder.outputDirectory(outdir);
        }
        if (paintingPassed) {
            builder.commit(Arm.PAINTING);
        }
        if (barcodingPassed) {
            builder.commit(Arm.BARCODING);
        }
        if (resume) {
            builder.resume(true);
        }
        if (parallelism != null) {
            if (parallelism < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--parallelism must be at least 1.");
            }
            builder.parallelism(parallelism);
        }
        builder.planOnly(planOnly).logLevel(logLevel);

        var result = new PipelineRunner().run(builder.build());
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }
}
