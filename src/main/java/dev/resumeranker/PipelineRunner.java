package dev.resumeranker;

import dev.resumeranker.model.FileMetadata;
import dev.resumeranker.model.RankedCandidate;
import dev.resumeranker.model.RankingReport;
import dev.resumeranker.model.ResumeSubmission;
import dev.resumeranker.service.ResumeRankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Runs one ranking batch from plain-text files on disk and logs the outcome.
 * The job description is one file; every {@code .txt} file of the resumes directory is a submission.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";
  static final long MAX_FILE_BYTES = 16L * 1024 * 1024;

  private final ResumeRankingService rankingService;

  @Value("${ranker.job-file:}")
  private String jobFile;

  @Value("${ranker.resumes-dir:}")
  private String resumesDir;

  @Value("${ranker.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes one ranking batch and handles the post-execution wait.
   *
   * @return Number of ranked (non-suppressed, non-failed) candidates
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Resume Ranker Starting");
    log.info(SEPARATOR);

    if (jobFile == null || jobFile.isBlank() || resumesDir == null || resumesDir.isBlank()) {
      log.warn("ranker.job-file or ranker.resumes-dir not set; nothing to rank");
      return 0;
    }

    try {
      String jobText = Files.readString(Path.of(jobFile), StandardCharsets.UTF_8);
      List<ResumeSubmission> submissions = readSubmissions(Path.of(resumesDir));

      RankingReport report = rankingService.rank(jobText, submissions).block();
      int count = report != null ? report.survivors().size() : 0;

      log.info(SEPARATOR);
      log.info("Resume Ranker Completed Successfully");
      if (report != null) {
        logReport(report);
      }
      log.info(SEPARATOR);

      handleMetricsWait();

      return count;
    } catch (Exception e) {
      log.error("Resume Ranker failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  List<ResumeSubmission> readSubmissions(Path dir) throws IOException {
    List<ResumeSubmission> submissions = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
          .sorted()
          .toList()) {
        long size = Files.size(file);
        if (size > MAX_FILE_BYTES) {
          log.warn("Skipping {}: {} bytes exceeds the 16MB limit", file.getFileName(), size);
          continue;
        }
        String name = file.getFileName().toString();
        Optional<String> text = read(file);
        if (text.isEmpty()) {
          continue;
        }
        FileMetadata metadata = new FileMetadata(name, size, Files.getLastModifiedTime(file).toInstant());
        submissions.add(new ResumeSubmission(name, text.get(), metadata));
      }
    }
    log.info("Read {} resumes from {}", submissions.size(), dir);
    return submissions;
  }

  /**
   * Reads a resume as UTF-8. Malformed bytes become U+FFFD; an unreadable file is skipped.
   */
  Optional<String> read(Path file) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      log.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
      return Optional.empty();
    }
    try {
      return Optional.of(StandardCharsets.UTF_8.newDecoder()
          .decode(ByteBuffer.wrap(bytes))
          .toString());
    } catch (CharacterCodingException e) {
      log.warn("{} is not valid UTF-8; replacing malformed bytes", file.getFileName());
      return Optional.of(decodeReplacing(bytes));
    }
  }

  private static String decodeReplacing(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new IllegalStateException("Replacing decoder rejected input", e);
    }
  }

  private void logReport(RankingReport report) {
    for (RankedCandidate candidate : report.candidates()) {
      String name = candidate.resume().getDisplayName();
      if (candidate.error() != null) {
        log.info("  --  FAILED  {} ({})", name, candidate.error());
      } else if (candidate.suppressed()) {
        log.info("  --  {}/100  {} [duplicate of {}]", candidate.result().compositePercent(), name,
            candidate.duplicateOf());
      } else {
        log.info("  #{}  {}/100  {} [{}]", candidate.rank(), candidate.result().compositePercent(), name,
            candidate.status());
      }
    }
    log.info("Candidates: {} ranked, {} shortlisted, {} suppressed, {} duplicate clusters",
        report.survivors().size(), report.shortlist().size(), report.suppressed().size(),
        report.duplicateClusterCount());
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
