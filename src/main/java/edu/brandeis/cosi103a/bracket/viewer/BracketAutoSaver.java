package edu.brandeis.cosi103a.bracket.viewer;

import edu.brandeis.cosi103a.bracket.runner.BracketFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Periodically writes every hosted bracket to {data-dir}/{tournamentId}/.
 */
@Component
public class BracketAutoSaver {

    private static final Logger log = LoggerFactory.getLogger(BracketAutoSaver.class);

    private final TournamentService tournamentService;
    private final Path dataDir;
    private final Clock clock;

    @Autowired
    public BracketAutoSaver(
            TournamentService tournamentService,
            @Value("${tournament.data-dir:./data}") String dataDir) {
        this(tournamentService, Path.of(dataDir), Clock.systemUTC());
    }

    BracketAutoSaver(TournamentService tournamentService, Path dataDir, Clock clock) {
        this.tournamentService = tournamentService;
        this.dataDir = dataDir;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${tournament.autosave-interval-ms:60000}",
               initialDelayString = "${tournament.autosave-interval-ms:60000}")
    public void autoSave() {
        saveAll();
    }

    /**
     * Saves every session that has a bracket.
     *
     * @return number of tournaments written
     */
    int saveAll() {
        int saved = 0;
        for (TournamentSession session : tournamentService.sessions()) {
            TournamentState state = session.state();
            if (state.bracket().isEmpty()) {
                continue;
            }
            BracketFileWriter writer = new BracketFileWriter(dataDir.resolve(session.id()));
            try {
                writer.writeTournamentMetadata(session.name(), state.competitors(), state.pools());
                writer.writeBracket(state.bracket().get());
                session.markSaved(Instant.now(clock));
                saved++;
            } catch (IOException e) {
                log.error("Auto-save failed for tournament {}", session.id(), e);
            }
        }
        if (saved > 0) {
            log.debug("Auto-saved {} tournament(s) to {}", saved, dataDir);
        }
        return saved;
    }
}
