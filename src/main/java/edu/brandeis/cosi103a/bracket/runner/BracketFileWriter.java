package edu.brandeis.cosi103a.bracket.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.brandeis.cosi103a.bracket.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.Competitor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes tournament metadata and bracket snapshots to disk.
 * Files are written atomically to prevent partial writes.
 */
public class BracketFileWriter {

    static final String TOURNAMENT_FILE = "tournament.json";
    static final String BRACKET_FILE = "bracket.json";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public BracketFileWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = ObjectMapperFactory.create();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes the tournament.json metadata file.
     */
    public void writeTournamentMetadata(String name, List<Competitor> competitors, List<Pool> pools)
            throws IOException {
        Map<String, Object> metadata = Map.of(
            "name", name,
            "competitors", competitors,
            "pools", pools
        );
        writeAtomically(TOURNAMENT_FILE, metadata);
    }

    /**
     * Writes the bracket.json snapshot atomically, replacing any previous one.
     */
    public void writeBracket(Bracket bracket) throws IOException {
        writeAtomically(BRACKET_FILE, bracket);
    }

    /**
     * Reads a previously written bracket.json (for resume support).
     */
    public Optional<Bracket> readBracket() throws IOException {
        Path source = outputDir.resolve(BRACKET_FILE);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(source.toFile(), Bracket.class));
    }

    public boolean bracketExists() {
        return Files.exists(outputDir.resolve(BRACKET_FILE));
    }

    private void writeAtomically(String filename, Object value) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        Path temp = outputDir.resolve(filename + ".tmp");
        objectMapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
