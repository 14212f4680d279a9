package socialpublish.publish;

import java.util.Objects;

/**
 * The outcome of one attempted target within a broadcast.
 *
 * @param target  normalized target name
 * @param outcome what happened
 */
public record TargetReport(String target, PublishOutcome outcome) {

  public TargetReport {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(outcome, "outcome");
  }

  public boolean succeeded() {
    return outcome instanceof PublishOutcome.Success;
  }
}
