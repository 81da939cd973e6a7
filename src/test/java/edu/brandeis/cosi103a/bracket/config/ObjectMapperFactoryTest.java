package edu.brandeis.cosi103a.bracket.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.bracket.core.Bracket;
import edu.brandeis.cosi103a.bracket.core.BracketBuilder;
import edu.brandeis.cosi103a.bracket.core.Competitor;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObjectMapperFactoryTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();

    @Test
    void emptySlotsSerializeAsNull() throws Exception {
        Bracket bracket = BracketBuilder.build(List.of(
            Competitor.of("a", "A"), Competitor.of("b", "B"),
            Competitor.of("c", "C"), Competitor.of("d", "D")));

        JsonNode tree = mapper.valueToTree(bracket);
        JsonNode finalMatch = tree.get("rounds").get(1).get("matches").get(0);

        assertEquals("r2-m1", finalMatch.get("id").asText());
        assertTrue(finalMatch.get("first").isNull());
        assertTrue(finalMatch.get("winner").isNull());
        assertEquals("a", tree.get("rounds").get(0).get("matches").get(0).get("first").get("id").asText());
    }

    @Test
    void bracketDeserializesNullsAsEmptyOptionals() throws Exception {
        String json = """
            {"rounds":[{"number":1,"matches":[
              {"id":"r1-m1","round":1,
               "first":{"id":"a","name":"A","seed":null,"poolId":null,"bye":false},
               "second":{"id":"bye-1","name":"BYE","seed":null,"poolId":null,"bye":true},
               "winner":{"id":"a","name":"A","seed":null,"poolId":null,"bye":false},
               "annotation":null}
            ]}]}
            """;

        Bracket bracket = mapper.readValue(json, Bracket.class);

        assertEquals("a", bracket.champion().orElseThrow().id());
        assertTrue(bracket.findMatch("r1-m1").orElseThrow().hasBye());
        assertTrue(bracket.findMatch("r1-m1").orElseThrow().annotation().isEmpty());
        assertTrue(bracket.champion().orElseThrow().seed().isEmpty());
    }

    @Test
    void instantsAreIsoStrings() throws Exception {
        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2024-03-01T10:15:30Z")));

        assertEquals("{\"at\":\"2024-03-01T10:15:30Z\"}", json);
    }
}
