package com.github.dbmdz.altopipeline.cli;

import com.github.dbmdz.altopipeline.config.PipelineConfig;
import com.github.dbmdz.altopipeline.export.CorpusExporter;
import com.github.dbmdz.altopipeline.formats.alto.AltoFileParser;
import com.github.dbmdz.altopipeline.model.ParsedCorpus;
import com.github.dbmdz.altopipeline.model.ParsedFile;
import com.github.dbmdz.altopipeline.pipeline.BatchRunner;
import com.github.dbmdz.altopipeline.pipeline.PatternPipeline;
import java.io.File;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Parses ALTO files, runs the configured pattern batches and exports the result. */
@Command(
    name = "alto-pipeline",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Categorize and clean up the text of ALTO files with configurable pattern chains")
public class AltoPipelineTool implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  @Parameters(arity = "1..*", description = "ALTO files or directories containing them")
  private List<File> inputs;

  @Option(
      names = {"-c", "--config"},
      description = "Pipeline configuration (.json or .xml)")
  private File configFile;

  @Option(names = {"--csv"}, description = "Write all elements to this delimited file")
  private File csvFile;

  @Option(names = {"--json"}, description = "Write all elements to this JSON file")
  private File jsonFile;

  @Option(
      names = {"--audit"},
      description = "Write all elements, removed ones included, with their match trail")
  private File auditFile;

  @Option(
      names = {"-d", "--delimiter"},
      description = "Column delimiter for --csv (default: from config, else tab)")
  private String delimiter;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new AltoPipelineTool()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    try {
      run();
      return 0;
    } catch (Exception e) {
      log.error("Processing failed: {}", e.getMessage(), e);
      return 1;
    }
  }

  void run() throws Exception {
    PipelineConfig config =
        configFile != null ? PipelineConfig.parse(configFile.getPath()) : new PipelineConfig();
    ParsedCorpus corpus = parse(config);
    PatternPipeline pipeline = new PatternPipeline(corpus);
    BatchRunner.fromConfig(pipeline, config).run(config.batches);

    CorpusExporter exporter = new CorpusExporter(corpus, config.export);
    if (csvFile != null) {
      exporter.saveCsv(csvFile.toPath(), delimiter != null ? delimiter : config.export.delimiter);
    }
    if (jsonFile != null) {
      exporter.saveJson(jsonFile.toPath());
    }
    if (auditFile != null) {
      exporter.saveAuditJson(auditFile.toPath());
    }
    log.info(
        "{} of {} elements left after the pipeline", corpus.size(), corpus.allElements().size());
  }

  ParsedCorpus parse(PipelineConfig config) throws Exception {
    AltoFileParser parser = new AltoFileParser(config);
    ParsedCorpus corpus = new ParsedCorpus();
    for (File input : inputs) {
      Path path = input.toPath();
      if (Files.isDirectory(path)) {
        for (ParsedFile file : parser.parseDirectory(path).getFiles()) {
          corpus.addFile(file);
        }
      } else {
        parser.addTo(corpus, path);
      }
    }
    return corpus;
  }
}
