package authz.modelgraph.io;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import authz.modelgraph.cycle.Cycle;
import authz.modelgraph.cycle.CycleReport;

/**
 * Writes a {@link CycleReport} as indented JSON.
 */
public final class CycleReportWriter {

    public static final String SCHEMA_VERSION = "fga-cycles/v1";

    private final ObjectMapper jsonMapper;

    public CycleReportWriter() {
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(CycleReport report, Writer out) throws IOException {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(out, "out");
        jsonMapper.writeValue(out, toDocument(report));
        out.write(System.lineSeparator());
        out.flush();
    }

    public String toJson(CycleReport report) throws IOException {
        return jsonMapper.writeValueAsString(toDocument(report));
    }

    static ReportDocument toDocument(CycleReport report) {
        final List<CycleEntry> entries = new ArrayList<>(report.cycles().size());
        for (Cycle c : report.cycles()) {
            entries.add(new CycleEntry(c.kind().lowerName(), c.labels()));
        }
        return new ReportDocument(
                SCHEMA_VERSION,
                report.hasCycles(),
                report.hasDefinitiveCycles(),
                report.totalCycles(),
                report.definitiveCount(),
                report.possibleCount(),
                entries
        );
    }

    // --- report records (written as JSON) ---

    public record ReportDocument(
            String schema,
            boolean hasCycles,
            boolean hasDefinitiveCycles,
            int totalCycleCount,
            int definitiveCycleCount,
            int possibleCycleCount,
            List<CycleEntry> cycles
    ) {
    }

    public record CycleEntry(
            String kind,
            List<String> labels
    ) {
    }
}
