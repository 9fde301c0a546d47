package de.uni_passau.fim.auermich.android_flows.core.utility;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.flows.DataFlow;
import de.uni_passau.fim.auermich.android_flows.core.flows.Flow;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallPath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * Renders flows and data flows as JSON reports.
 */
public final class ReportWriter {

    private static final Logger LOGGER = LogManager.getLogger(ReportWriter.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls()
            .disableHtmlEscaping().create();

    private ReportWriter() {
        throw new UnsupportedOperationException("Utility class!");
    }

    public static JsonObject toJson(Flow flow) {
        JsonObject json = new JsonObject();
        json.addProperty("entryPoint", flow.getEntryPointClass());
        json.addProperty("componentType", flow.getComponentType().getTag());
        json.addProperty("sink", flow.getSink().getFullSignature());
        json.addProperty("deeplinkHandler", flow.isDeeplinkHandler());
        json.addProperty("pathCount", flow.getPathCount());
        json.addProperty("minPathLength", flow.getMinPathLength());
        JsonArray paths = new JsonArray();
        flow.getPaths().forEach(path -> paths.add(toJson(path)));
        json.add("paths", paths);
        return json;
    }

    public static JsonObject toJson(DataFlow dataFlow) {
        JsonObject json = new JsonObject();
        json.addProperty("entryPoint", dataFlow.getFlow().getEntryPointClass());
        json.addProperty("source", dataFlow.getSource().map(MethodReference::getFullSignature).orElse(null));
        json.addProperty("sink", dataFlow.getSink().getFullSignature());
        json.addProperty("evidence", dataFlow.getEvidence().name());
        json.addProperty("constantSinkArgument", dataFlow.isConstantSinkArgument());
        json.addProperty("confidence", dataFlow.getConfidence());
        json.addProperty("confidenceLevel", dataFlow.getConfidenceLevel().name());
        json.add("path", toJson(dataFlow.getPath()));
        return json;
    }

    private static JsonArray toJson(CallPath path) {
        JsonArray methods = new JsonArray();
        path.getMethods().forEach(method -> methods.add(method.getFullSignature()));
        return methods;
    }

    /**
     * Renders the given flows as a JSON array.
     *
     * @param flows The flows.
     * @return Returns the pretty printed JSON.
     */
    public static String flowsToJson(List<Flow> flows) {
        JsonArray array = new JsonArray();
        flows.forEach(flow -> array.add(toJson(flow)));
        return GSON.toJson(array);
    }

    /**
     * Renders the given data flows as a JSON array.
     *
     * @param dataFlows The data flows.
     * @return Returns the pretty printed JSON.
     */
    public static String dataFlowsToJson(List<DataFlow> dataFlows) {
        JsonArray array = new JsonArray();
        dataFlows.forEach(dataFlow -> array.add(toJson(dataFlow)));
        return GSON.toJson(array);
    }

    /**
     * Writes a report of the given data flows.
     *
     * @param dataFlows The data flows.
     * @param output The report file, overwritten if it exists.
     * @throws IOException If the file can't be written.
     */
    public static void writeDataFlows(List<DataFlow> dataFlows, File output) throws IOException {
        LOGGER.info("Writing " + dataFlows.size() + " data flows to " + output);
        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            writer.write(dataFlowsToJson(dataFlows));
        }
    }
}
