package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.Competitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hosts tournaments in memory and broadcasts every change to WebSocket subscribers.
 */
@Service
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private final Map<String, TournamentSession> sessions = new ConcurrentHashMap<>();
    private final SimpMessagingTemplate messagingTemplate;
    private final int historyLimit;

    public TournamentService(
            @Value("${tournament.history-limit:50}") int historyLimit,
            SimpMessagingTemplate messagingTemplate) {
        this.historyLimit = historyLimit;
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * Creates a tournament with an initial competitor list.
     *
     * @return snapshot of the new tournament
     */
    public TournamentSnapshot createTournament(String name, List<Competitor> competitors) {
        String tournamentId = UUID.randomUUID().toString();
        TournamentSession session = new TournamentSession(tournamentId, name, historyLimit);
        if (!competitors.isEmpty()) {
            session.importCompetitors(competitors);
        }
        sessions.put(tournamentId, session);
        log.info("Created tournament {} ({}) with {} competitors", tournamentId, name, competitors.size());
        return publish(session);
    }

    public List<TournamentSummary> listTournaments() {
        List<TournamentSummary> result = new ArrayList<>();
        for (TournamentSession session : sessions.values()) {
            TournamentSnapshot snapshot = session.snapshot();
            result.add(new TournamentSummary(snapshot.id(), snapshot.name(), snapshot.status(),
                snapshot.competitors().size(), snapshot.completionPercentage()));
        }
        return result;
    }

    public TournamentSnapshot getTournament(String tournamentId) {
        return session(tournamentId).snapshot();
    }

    public Optional<TournamentSnapshot> findTournament(String tournamentId) {
        return Optional.ofNullable(sessions.get(tournamentId)).map(TournamentSession::snapshot);
    }

    public TournamentSnapshot addCompetitor(String tournamentId, Competitor competitor) {
        TournamentSession session = session(tournamentId);
        session.addCompetitor(competitor);
        return publish(session);
    }

    public TournamentSnapshot removeCompetitor(String tournamentId, String competitorId) {
        TournamentSession session = session(tournamentId);
        if (!session.removeCompetitor(competitorId)) {
            log.debug("Competitor {} not registered in tournament {}", competitorId, tournamentId);
        }
        return publish(session);
    }

    public TournamentSnapshot clearCompetitors(String tournamentId) {
        TournamentSession session = session(tournamentId);
        session.clearCompetitors();
        return publish(session);
    }

    public TournamentSnapshot distributePools(String tournamentId) {
        TournamentSession session = session(tournamentId);
        session.distributePools();
        return publish(session);
    }

    public TournamentSnapshot generateBracket(String tournamentId) {
        TournamentSession session = session(tournamentId);
        Bracket bracket = session.generateBracket();
        log.info("Generated bracket for tournament {}: {} slots, {} rounds",
            tournamentId, bracket.slotCount(), bracket.roundCount());
        return publish(session);
    }

    /**
     * Records a result. Unknown matches, bye matches and results that change nothing
     * are logged and otherwise ignored.
     */
    public TournamentSnapshot recordWinner(String tournamentId, String matchId, String winnerId) {
        TournamentSession session = session(tournamentId);
        if (!session.recordWinner(matchId, winnerId)) {
            log.info("Result {}={} left tournament {} unchanged", matchId, winnerId, tournamentId);
        }
        TournamentSnapshot snapshot = publish(session);
        if (!snapshot.staleMatchIds().isEmpty()) {
            log.warn("Tournament {} has later-round winners decided from replaced results: {}",
                tournamentId, snapshot.staleMatchIds());
        }
        return snapshot;
    }

    public TournamentSnapshot annotate(String tournamentId, String matchId, String text) {
        TournamentSession session = session(tournamentId);
        if (!session.annotate(matchId, text)) {
            log.info("No match {} in tournament {} to annotate", matchId, tournamentId);
        }
        return publish(session);
    }

    public TournamentSnapshot undo(String tournamentId) {
        TournamentSession session = session(tournamentId);
        session.undo();
        return publish(session);
    }

    public TournamentSnapshot redo(String tournamentId) {
        TournamentSession session = session(tournamentId);
        session.redo();
        return publish(session);
    }

    public TournamentSnapshot setStatus(String tournamentId, TournamentStatus status) {
        TournamentSession session = session(tournamentId);
        session.setStatus(status);
        return publish(session);
    }

    /**
     * All hosted sessions, for the auto-save job.
     */
    Collection<TournamentSession> sessions() {
        return List.copyOf(sessions.values());
    }

    private TournamentSession session(String tournamentId) {
        TournamentSession session = sessions.get(tournamentId);
        if (session == null) {
            throw new TournamentNotFoundException("Tournament not found: " + tournamentId);
        }
        return session;
    }

    /**
     * Sends the session's current snapshot to /topic/tournaments/{id} and returns it.
     */
    private TournamentSnapshot publish(TournamentSession session) {
        TournamentSnapshot snapshot = session.snapshot();
        try {
            messagingTemplate.convertAndSend("/topic/tournaments/" + session.id(), snapshot);
        } catch (Exception e) {
            // Broadcast failures never fail the request
            log.warn("Failed to send WebSocket update for tournament {}: {}", session.id(), e.getMessage());
        }
        return snapshot;
    }

    public record TournamentSummary(
        String id,
        String name,
        TournamentStatus status,
        int competitorCount,
        int completionPercentage
    ) {}
}
