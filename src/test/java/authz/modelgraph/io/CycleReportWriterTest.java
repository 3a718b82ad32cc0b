package authz.modelgraph.io;

import java.io.StringWriter;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import authz.modelgraph.TestModels;
import authz.modelgraph.cycle.CycleAnalyzer;
import authz.modelgraph.cycle.CycleReport;
import authz.modelgraph.graph.GraphBuilder;
import authz.modelgraph.model.AuthorizationModel;

import static org.junit.jupiter.api.Assertions.*;

class CycleReportWriterTest {

    private final CycleReportWriter writer = new CycleReportWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private static CycleReport report(AuthorizationModel model) {
        return new CycleAnalyzer().classify(new GraphBuilder(model).build());
    }

    @Test
    void writesCountsAndCycles() throws Exception {
        final StringWriter out = new StringWriter();
        writer.write(report(TestModels.editorViewerLoop()), out);

        final JsonNode json = mapper.readTree(out.toString());
        assertEquals(CycleReportWriter.SCHEMA_VERSION, json.get("schema").asText());
        assertTrue(json.get("hasCycles").asBoolean());
        assertFalse(json.get("hasDefinitiveCycles").asBoolean());
        assertEquals(2, json.get("totalCycleCount").asInt());
        assertEquals(0, json.get("definitiveCycleCount").asInt());
        assertEquals(2, json.get("possibleCycleCount").asInt());
        assertEquals(2, json.get("cycles").size());
        assertEquals("possible", json.get("cycles").get(0).get("kind").asText());
        assertEquals("document#editor", json.get("cycles").get(0).get("labels").get(0).asText());
    }

    @Test
    void marksDefinitiveCycles() throws Exception {
        final JsonNode json = mapper.readTree(writer.toJson(report(TestModels.selfComputed())));

        assertTrue(json.get("hasDefinitiveCycles").asBoolean());
        assertEquals("definitive", json.get("cycles").get(0).get("kind").asText());
        assertEquals("resource#x", json.get("cycles").get(0).get("labels").get(0).asText());
    }

    @Test
    void emptyReport() throws Exception {
        final JsonNode json = mapper.readTree(writer.toJson(report(TestModels.directOnly())));

        assertFalse(json.get("hasCycles").asBoolean());
        assertEquals(0, json.get("totalCycleCount").asInt());
        assertTrue(json.get("cycles").isEmpty());
    }
}
