package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.BracketBuilder;
import edu.brandeis.cosi103a.bracket.core.Competitor;
import edu.brandeis.cosi103a.bracket.core.InvalidInputException;
import edu.brandeis.cosi103a.bracket.core.Match;
import edu.brandeis.cosi103a.bracket.core.Propagator;
import edu.brandeis.cosi103a.bracket.core.Seeder;
import edu.brandeis.cosi103a.bracket.core.StaleWinnerDetector;
import edu.brandeis.cosi103a.bracket.runner.CompetitorOrdering;
import edu.brandeis.cosi103a.bracket.runner.PoolDistributor;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One hosted tournament: its current state plus a bounded undo/redo history.
 *
 * <p>All methods synchronize on the session, which serializes result entry per tournament.
 * Competitor changes and recorded results are undoable; pools, bracket generation,
 * annotations and status changes are not.
 */
public class TournamentSession {

    private final String id;
    private final String name;
    private final int historyLimit;

    private TournamentState state = TournamentState.initial();
    private final Deque<TournamentState> undoStack = new ArrayDeque<>();
    private final Deque<TournamentState> redoStack = new ArrayDeque<>();
    private Instant lastSaved;

    public TournamentSession(String id, String name, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("History limit must be positive: " + historyLimit);
        }
        this.id = id;
        this.name = name;
        this.historyLimit = historyLimit;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public synchronized TournamentState state() {
        return state;
    }

    /**
     * @throws InvalidInputException if the competitor is a bye, unnamed, or its id is taken
     */
    public synchronized void addCompetitor(Competitor competitor) {
        importCompetitors(List.of(competitor));
    }

    /**
     * Appends all competitors as one undoable step.
     *
     * @throws InvalidInputException if any competitor is invalid or the ids collide
     */
    public synchronized void importCompetitors(List<Competitor> newCompetitors) {
        Set<String> ids = new HashSet<>();
        for (Competitor existing : state.competitors()) {
            ids.add(existing.id());
        }
        for (Competitor competitor : newCompetitors) {
            validate(competitor);
            if (!ids.add(competitor.id())) {
                throw new InvalidInputException("Duplicate competitor id: " + competitor.id());
            }
        }
        List<Competitor> combined = new ArrayList<>(state.competitors());
        combined.addAll(newCompetitors);
        commit(state.withCompetitors(combined));
    }

    /**
     * @return false if no competitor has that id
     */
    public synchronized boolean removeCompetitor(String competitorId) {
        List<Competitor> remaining = state.competitors().stream()
            .filter(c -> !c.id().equals(competitorId))
            .toList();
        if (remaining.size() == state.competitors().size()) {
            return false;
        }
        commit(state.withCompetitors(remaining));
        return true;
    }

    /**
     * Resets to an empty, not-started tournament without touching the history.
     */
    public synchronized void clearCompetitors() {
        state = TournamentState.initial();
    }

    public synchronized void distributePools() {
        state = state.withPools(PoolDistributor.distribute(state.competitors()))
            .withStatus(TournamentStatus.IN_PROGRESS);
    }

    /**
     * Seeds the current competitors (ordered by seed) into a fresh bracket.
     *
     * @throws IllegalStateException if archived or fewer than 2 competitors are registered
     */
    public synchronized Bracket generateBracket() {
        if (state.status() == TournamentStatus.ARCHIVED) {
            throw new IllegalStateException("Tournament " + id + " is archived");
        }
        if (state.competitors().size() < 2) {
            throw new IllegalStateException("At least 2 competitors are required to generate a bracket");
        }
        Bracket bracket = BracketBuilder.build(Seeder.seed(CompetitorOrdering.bySeed(state.competitors())));
        state = state.withBracket(bracket).withStatus(TournamentStatus.IN_PROGRESS);
        return bracket;
    }

    /**
     * Applies a result through {@link Propagator}; unchanged brackets leave no history entry.
     *
     * @return true if the bracket changed
     * @throws IllegalStateException if no bracket has been generated
     */
    public synchronized boolean recordWinner(String matchId, String winnerId) {
        Bracket current = requireBracket();
        Bracket updated = Propagator.applyWinner(current, matchId, winnerId);
        if (updated.equals(current)) {
            return false;
        }
        commit(state.withBracket(updated));
        return true;
    }

    /**
     * Sets or clears (blank text) a match annotation.
     *
     * @return false if the match does not exist
     */
    public synchronized boolean annotate(String matchId, String text) {
        Bracket current = requireBracket();
        Optional<Match> match = current.findMatch(matchId);
        if (match.isEmpty()) {
            return false;
        }
        Optional<String> annotation = text == null || text.isBlank() ? Optional.empty() : Optional.of(text);
        state = state.withBracket(current.withMatch(match.get().withAnnotation(annotation)));
        return true;
    }

    public synchronized void setStatus(TournamentStatus status) {
        state = state.withStatus(status);
    }

    /**
     * @return false if there is nothing to undo
     */
    public synchronized boolean undo() {
        if (undoStack.isEmpty()) {
            return false;
        }
        redoStack.push(state);
        state = undoStack.pollLast();
        return true;
    }

    /**
     * @return false if there is nothing to redo
     */
    public synchronized boolean redo() {
        if (redoStack.isEmpty()) {
            return false;
        }
        undoStack.addLast(state);
        state = redoStack.pop();
        return true;
    }

    public synchronized void markSaved(Instant when) {
        this.lastSaved = when;
    }

    public synchronized TournamentSnapshot snapshot() {
        Optional<Bracket> bracket = state.bracket();
        return new TournamentSnapshot(
            id,
            name,
            state.status(),
            state.competitors(),
            state.pools(),
            bracket,
            bracket.map(Bracket::completionPercentage).orElse(0),
            bracket.<List<String>>map(StaleWinnerDetector::findStaleMatches).orElse(List.of()),
            Optional.ofNullable(lastSaved),
            !undoStack.isEmpty(),
            !redoStack.isEmpty()
        );
    }

    private void commit(TournamentState next) {
        undoStack.addLast(state);
        while (undoStack.size() > historyLimit) {
            undoStack.pollFirst();
        }
        redoStack.clear();
        state = next;
    }

    private Bracket requireBracket() {
        return state.bracket()
            .orElseThrow(() -> new IllegalStateException("No bracket generated for tournament " + id));
    }

    private static void validate(Competitor competitor) {
        if (competitor.bye() || Competitor.isReservedId(competitor.id())) {
            throw new InvalidInputException("Competitor id is reserved for byes: " + competitor.id());
        }
        if (competitor.id() == null || competitor.id().isBlank()) {
            throw new InvalidInputException("Competitor id must not be blank");
        }
        if (competitor.name() == null || competitor.name().isBlank()) {
            throw new InvalidInputException("Competitor name must not be blank: " + competitor.id());
        }
    }
}
