package cs1302.cstep.record;

import java.time.Instant;

/**
 * Facts about the run a timeline belongs to.
 *
 * @param program A name for the program.
 * @param startedAt When recording started.
 * @param firstStep Step number of the oldest snapshot kept.
 * @param lastStep Step number of the newest snapshot.
 * @param exitCode Exit code of a completed run.
 * @param error Whether the run failed.
 * @param errorMessage The failure, or the empty string.
 */
public record TimelineMetadata(
    String program,
    Instant startedAt,
    long firstStep,
    long lastStep,
    int exitCode,
    boolean error,
    String errorMessage) {

  public TimelineMetadata {
    program = program == null ? "" : program;
    errorMessage = errorMessage == null ? "" : errorMessage;
  }

  public static TimelineMetadata start(String program) {
    return new TimelineMetadata(program, Instant.now(), 0, 0, 0, false, "");
  }

  public TimelineMetadata withSteps(long first, long last) {
    return new TimelineMetadata(program, startedAt, first, last, exitCode, error, errorMessage);
  }

  public TimelineMetadata withOutcome(int code, boolean failed, String message) {
    return new TimelineMetadata(program, startedAt, firstStep, lastStep, code, failed, message);
  }
}
