package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.Competitor;
import edu.brandeis.cosi103a.bracket.runner.Pool;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time view of a tournament, returned by the API and broadcast to subscribers.
 *
 * @param completionPercentage share of decided matches, 0 when no bracket exists
 * @param staleMatchIds        matches whose winner no longer fits their slots
 */
public record TournamentSnapshot(
    String id,
    String name,
    TournamentStatus status,
    List<Competitor> competitors,
    List<Pool> pools,
    Optional<Bracket> bracket,
    int completionPercentage,
    List<String> staleMatchIds,
    Optional<Instant> lastSaved,
    boolean canUndo,
    boolean canRedo
) {}
