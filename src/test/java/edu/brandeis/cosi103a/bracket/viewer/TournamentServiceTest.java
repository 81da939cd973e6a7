package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.core.Competitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TournamentServiceTest {

    private SimpMessagingTemplate messagingTemplate;
    private TournamentService service;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        service = new TournamentService(50, messagingTemplate);
    }

    @Test
    void createTournament_broadcastsInitialSnapshot() {
        TournamentSnapshot snapshot = service.createTournament("Open", players());

        assertEquals("Open", snapshot.name());
        assertEquals(TournamentStatus.NOT_STARTED, snapshot.status());
        assertEquals(4, snapshot.competitors().size());
        verify(messagingTemplate).convertAndSend(eq("/topic/tournaments/" + snapshot.id()), any(TournamentSnapshot.class));
    }

    @Test
    void unknownTournamentIsNotFound() {
        assertThrows(TournamentNotFoundException.class, () -> service.getTournament("missing"));
        assertThrows(TournamentNotFoundException.class, () -> service.recordWinner("missing", "r1-m1", "a"));
        assertTrue(service.findTournament("missing").isEmpty());
    }

    @Test
    void listTournaments_summarizesProgress() {
        String id = service.createTournament("Open", players()).id();
        service.generateBracket(id);
        service.recordWinner(id, "r1-m1", "a");

        List<TournamentService.TournamentSummary> summaries = service.listTournaments();

        assertEquals(1, summaries.size());
        assertEquals(new TournamentService.TournamentSummary(id, "Open", TournamentStatus.IN_PROGRESS, 4, 33),
            summaries.get(0));
    }

    @Test
    void recordWinner_returnsUpdatedSnapshotAndBroadcastsEachChange() {
        String id = service.createTournament("Open", players()).id();
        service.generateBracket(id);

        TournamentSnapshot snapshot = service.recordWinner(id, "r1-m2", "d");

        assertEquals("d", snapshot.bracket().orElseThrow().findMatch("r2-m1").orElseThrow().second().orElseThrow().id());
        assertTrue(snapshot.canUndo());
        verify(messagingTemplate, times(3)).convertAndSend(eq("/topic/tournaments/" + id), any(TournamentSnapshot.class));
    }

    @Test
    void undoRedo_roundTripThroughService() {
        String id = service.createTournament("Open", players()).id();
        service.generateBracket(id);
        service.recordWinner(id, "r1-m1", "b");

        TournamentSnapshot undone = service.undo(id);
        assertEquals(0, undone.completionPercentage());

        TournamentSnapshot redone = service.redo(id);
        assertEquals(33, redone.completionPercentage());
    }

    @Test
    void broadcastFailureDoesNotFailRequest() {
        doThrow(new MessageDeliveryException("broker down"))
            .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        TournamentSnapshot snapshot = service.createTournament("Open", players());

        assertEquals(snapshot, service.getTournament(snapshot.id()));
    }

    @Test
    void setStatus_isReflectedInSnapshot() {
        String id = service.createTournament("Open", players()).id();

        assertEquals(TournamentStatus.ARCHIVED, service.setStatus(id, TournamentStatus.ARCHIVED).status());
    }

    @Test
    void sessions_exposesHostedTournaments() {
        service.createTournament("One", players());
        service.createTournament("Two", List.of());

        assertEquals(2, service.sessions().size());
    }

    private static List<Competitor> players() {
        return List.of(Competitor.of("a", "A"), Competitor.of("b", "B"),
            Competitor.of("c", "C"), Competitor.of("d", "D"));
    }
}
