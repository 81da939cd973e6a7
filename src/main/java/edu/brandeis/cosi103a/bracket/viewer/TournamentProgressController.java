package edu.brandeis.cosi103a.bracket.viewer;

import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for bracket updates.
 * Clients can subscribe to /topic/tournaments/{tournamentId} to receive every change.
 */
@Controller
public class TournamentProgressController {

    private final TournamentService tournamentService;

    public TournamentProgressController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    /**
     * Handles subscription requests for a tournament.
     * When a client subscribes, returns the current snapshot immediately.
     * Further updates are pushed automatically by TournamentService.
     *
     * @param tournamentId the tournament ID to subscribe to
     * @return the current snapshot, or null if not found
     */
    @MessageMapping("/tournaments/{tournamentId}/subscribe")
    @SendTo("/topic/tournaments/{tournamentId}")
    public TournamentSnapshot subscribeTournament(@DestinationVariable String tournamentId) {
        return tournamentService.findTournament(tournamentId).orElse(null);
    }
}
