package edu.brandeis.cosi103a.bracket.viewer;

/**
 * Lifecycle of a hosted tournament.
 */
public enum TournamentStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    ARCHIVED
}
