package authz.modelgraph;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import authz.modelgraph.cycle.Cycle;
import authz.modelgraph.cycle.CycleReport;
import authz.modelgraph.graph.ModelLookupException;
import authz.modelgraph.io.CycleReportWriter;
import authz.modelgraph.io.RenderException;
import authz.modelgraph.load.ModelFormatException;
import authz.modelgraph.load.ModelLoader;
import authz.modelgraph.model.AuthorizationModel;
import authz.modelgraph.model.UnsupportedRewriteVariantException;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path modelPath = null;
        String outputPath = null;
        String cyclesPath = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--model-path=")) {
                    modelPath = Paths.get(arg.substring("--model-path=".length()));
                    continue;
                }
                if (arg.startsWith("--output-path=")) {
                    outputPath = arg.substring("--output-path=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--cycles-path=")) {
                    cyclesPath = arg.substring("--cycles-path=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (modelPath == null) {
                System.err.println("ERROR: --model-path is required");
                printUsage();
                return 2;
            }

            final AuthorizationModel model = new ModelLoader().load(modelPath);
            final ModelGraphPipeline.Result result = new ModelGraphPipeline().run(model);

            // Render everything before touching any output
            String cyclesJson = null;
            if (cyclesPath != null && !cyclesPath.isEmpty()) {
                final StringWriter sw = new StringWriter();
                new CycleReportWriter().write(result.cycles(), sw);
                cyclesJson = sw.toString();
            }

            writeTo(outputPath, result.dot());
            if (cyclesJson != null) {
                writeTo(cyclesPath, cyclesJson);
            }

            logCycles(result.cycles());
            return 0;
        } catch (RenderException ex) {
            System.err.println("ERROR: failed to render graph: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (ModelFormatException ex) {
            System.err.println("ERROR: failed to read model: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (ModelLookupException | UnsupportedRewriteVariantException ex) {
            System.err.println("ERROR: failed to build graph: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void writeTo(String path, String content) throws IOException {
        if (path == null || path.isEmpty() || "-".equals(path)) {
            final Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
            stdout.write(content);
            stdout.flush();
            return;
        }
        Files.writeString(Paths.get(path), content, StandardCharsets.UTF_8);
    }

    private static void logCycles(CycleReport report) {
        if (!report.hasCycles()) {
            return;
        }
        System.err.println("WARN: model has " + report.totalCycles() + " cycle(s): "
                + report.definitiveCount() + " definitive, "
                + report.possibleCount() + " possible");
        for (Cycle c : report.definitiveCycles()) {
            System.err.println("WARN: definitive cycle: " + safeMsg(c.describe()));
        }
    }

    private static void printUsage() {
        System.out.println("Usage: fga-model-graph --model-path=<file> [options]");
        System.out.println("Options:");
        System.out.println("  --model-path=<path>     Authorization model in JSON form (required)");
        System.out.println("  --output-path=<path>    DOT output file, '-' for stdout (default: stdout)");
        System.out.println("  --cycles-path=<path>    Write the cycle report as JSON, '-' for stdout");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
