package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.Competitor;
import edu.brandeis.cosi103a.bracket.runner.Pool;

import java.util.List;
import java.util.Optional;

/**
 * Immutable value of everything undo/redo restores for one tournament.
 */
public record TournamentState(
    List<Competitor> competitors,
    List<Pool> pools,
    Optional<Bracket> bracket,
    TournamentStatus status
) {

    public static TournamentState initial() {
        return new TournamentState(List.of(), List.of(), Optional.empty(), TournamentStatus.NOT_STARTED);
    }

    public TournamentState withCompetitors(List<Competitor> newCompetitors) {
        return new TournamentState(List.copyOf(newCompetitors), pools, bracket, status);
    }

    public TournamentState withPools(List<Pool> newPools) {
        return new TournamentState(competitors, List.copyOf(newPools), bracket, status);
    }

    public TournamentState withBracket(Bracket newBracket) {
        return new TournamentState(competitors, pools, Optional.of(newBracket), status);
    }

    public TournamentState withStatus(TournamentStatus newStatus) {
        return new TournamentState(competitors, pools, bracket, newStatus);
    }
}
