package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.core.Competitor;
import edu.brandeis.cosi103a.bracket.core.InvalidInputException;
import edu.brandeis.cosi103a.bracket.viewer.dto.AnnotationRequest;
import edu.brandeis.cosi103a.bracket.viewer.dto.CompetitorRequest;
import edu.brandeis.cosi103a.bracket.viewer.dto.CreateTournamentRequest;
import edu.brandeis.cosi103a.bracket.viewer.dto.StatusRequest;
import edu.brandeis.cosi103a.bracket.viewer.dto.WinnerRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for hosting brackets and entering results.
 */
@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;

    public TournamentController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    /**
     * Lists all hosted tournaments with summary info.
     */
    @GetMapping
    public List<TournamentService.TournamentSummary> listTournaments() {
        return tournamentService.listTournaments();
    }

    /**
     * Creates a tournament. Returns 201 Created with its snapshot.
     */
    @PostMapping
    public ResponseEntity<TournamentSnapshot> createTournament(@Valid @RequestBody CreateTournamentRequest request) {
        List<Competitor> competitors = request.competitors().stream()
            .map(TournamentController::toCompetitor)
            .toList();
        TournamentSnapshot snapshot = tournamentService.createTournament(request.tournamentName(), competitors);
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
    }

    @GetMapping("/{tournamentId}")
    public TournamentSnapshot getTournament(@PathVariable String tournamentId) {
        return tournamentService.getTournament(tournamentId);
    }

    @PostMapping("/{tournamentId}/competitors")
    public TournamentSnapshot addCompetitor(@PathVariable String tournamentId,
                                            @Valid @RequestBody CompetitorRequest request) {
        return tournamentService.addCompetitor(tournamentId, toCompetitor(request));
    }

    @DeleteMapping("/{tournamentId}/competitors/{competitorId}")
    public TournamentSnapshot removeCompetitor(@PathVariable String tournamentId,
                                               @PathVariable String competitorId) {
        return tournamentService.removeCompetitor(tournamentId, competitorId);
    }

    @DeleteMapping("/{tournamentId}/competitors")
    public TournamentSnapshot clearCompetitors(@PathVariable String tournamentId) {
        return tournamentService.clearCompetitors(tournamentId);
    }

    @PostMapping("/{tournamentId}/pools")
    public TournamentSnapshot distributePools(@PathVariable String tournamentId) {
        return tournamentService.distributePools(tournamentId);
    }

    /**
     * Seeds the registered competitors into a new bracket, replacing any previous one.
     */
    @PostMapping("/{tournamentId}/bracket")
    public TournamentSnapshot generateBracket(@PathVariable String tournamentId) {
        return tournamentService.generateBracket(tournamentId);
    }

    /**
     * Declares a match winner. Unknown matches and bye matches leave the bracket unchanged.
     */
    @PostMapping("/{tournamentId}/matches/{matchId}/winner")
    public TournamentSnapshot recordWinner(@PathVariable String tournamentId,
                                           @PathVariable String matchId,
                                           @Valid @RequestBody WinnerRequest request) {
        return tournamentService.recordWinner(tournamentId, matchId, request.competitorId());
    }

    @PutMapping("/{tournamentId}/matches/{matchId}/annotation")
    public TournamentSnapshot annotate(@PathVariable String tournamentId,
                                       @PathVariable String matchId,
                                       @RequestBody AnnotationRequest request) {
        return tournamentService.annotate(tournamentId, matchId, request.text());
    }

    @PostMapping("/{tournamentId}/undo")
    public TournamentSnapshot undo(@PathVariable String tournamentId) {
        return tournamentService.undo(tournamentId);
    }

    @PostMapping("/{tournamentId}/redo")
    public TournamentSnapshot redo(@PathVariable String tournamentId) {
        return tournamentService.redo(tournamentId);
    }

    @PutMapping("/{tournamentId}/status")
    public TournamentSnapshot setStatus(@PathVariable String tournamentId,
                                        @Valid @RequestBody StatusRequest request) {
        return tournamentService.setStatus(tournamentId, request.status());
    }

    static Competitor toCompetitor(CompetitorRequest request) {
        String id = request.id() == null || request.id().isBlank()
            ? Competitor.idFromName(request.name())
            : request.id();
        return new Competitor(id, request.name(), Optional.ofNullable(request.seed()), Optional.empty(), false);
    }

    @ExceptionHandler(TournamentNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TournamentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler({InvalidInputException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }
}
