package com.codeheadsystems.cipherscore.server.model;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import java.time.Instant;
import java.util.Optional;

/**
 * One identity's encrypted financial attributes plus its most recently computed encrypted score.
 * <p>
 * {@code revision} increases on every submission. {@code scoreRevision} is the revision the score
 * was computed from, so a score is fresh exactly when both match.
 *
 * @param owner           the data subject
 * @param attributes      the current encrypted attributes
 * @param lastUpdated     when the attributes were last submitted
 * @param revision        submission counter, starting at 1
 * @param computedScore   the last computed score, or null
 * @param scoreComputedAt when the score was computed, or null
 * @param scoreRevision   revision the score was computed from, or 0
 */
public record CreditProfile(
    Identity owner,
    FinancialAttributes attributes,
    Instant lastUpdated,
    long revision,
    OpaqueValue computedScore,
    Instant scoreComputedAt,
    long scoreRevision) {

  /**
   * A first submission.
   */
  public static CreditProfile initial(Identity owner, FinancialAttributes attributes, Instant at) {
    return new CreditProfile(owner, attributes, at, 1, null, null, 0);
  }

  /**
   * Replaces the attributes wholesale. A previously computed score is kept and becomes stale.
   */
  public CreditProfile resubmit(FinancialAttributes newAttributes, Instant at) {
    return new CreditProfile(owner, newAttributes, at, revision + 1, computedScore, scoreComputedAt, scoreRevision);
  }

  /**
   * Attaches a score computed from the current revision.
   */
  public CreditProfile withScore(OpaqueValue score, Instant at) {
    return new CreditProfile(owner, attributes, lastUpdated, revision, score, at, revision);
  }

  public Optional<OpaqueValue> score() {
    return Optional.ofNullable(computedScore);
  }

  public ScoreStatus scoreStatus() {
    if (computedScore == null) {
      return ScoreStatus.NONE;
    }
    return scoreRevision == revision ? ScoreStatus.FRESH : ScoreStatus.STALE;
  }

  public OpaqueValue income() {
    return attributes.income();
  }

  public OpaqueValue assets() {
    return attributes.assets();
  }

  public OpaqueValue debts() {
    return attributes.debts();
  }

  public OpaqueValue paymentHistory() {
    return attributes.paymentHistory();
  }

  public OpaqueValue creditUtilization() {
    return attributes.creditUtilization();
  }
}
