package co.fanki.flowviz.flowmd.application;

import co.fanki.flowviz.export.domain.EdgeCsvExporter;
import co.fanki.flowviz.flowmd.domain.FlowGraph;
import co.fanki.flowviz.flowmd.domain.FlowMdException;
import co.fanki.flowviz.highlight.domain.DownstreamResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the FlowMD viewer.
 *
 * <p>The browser posts the FlowMD text once to obtain the graph and
 * sends the graph back with every highlight, search or export call,
 * so the server keeps no per-viewer state.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/flowmd")
@Tag(name = "FlowMD",
        description = "Parse FlowMD flowcharts and query the parsed graph")
public class FlowGraphController {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowGraphController.class);

    private final FlowGraphService flowGraphService;

    /**
     * Creates a new FlowGraphController.
     *
     * @param theFlowGraphService the FlowMD service
     */
    public FlowGraphController(final FlowGraphService theFlowGraphService) {
        this.flowGraphService = theFlowGraphService;
    }

    /**
     * Parses FlowMD text.
     *
     * @param request the source and optional limits
     * @return the graph, or 400 with the parse error
     */
    @PostMapping("/parse")
    @Operation(summary = "Parse FlowMD text",
            description = "Returns nodes, edges, groups and warnings."
                    + " Fails when the graph/flowchart header is missing"
                    + " or the node count exceeds maxNodes.")
    public ResponseEntity<?> parse(@RequestBody final ParseRequest request) {
        try {
            final FlowGraph graph = flowGraphService.parse(request.text(),
                    request.maxNodes(), request.preferredMaxNodes());
            return ResponseEntity.ok(graph);
        } catch (final FlowMdException e) {
            LOG.warn("FlowMD parse failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e));
        }
    }

    /**
     * Computes the downstream subgraph of a node.
     *
     * @param request the graph and start node
     * @return the reachable nodes and edges
     */
    @PostMapping("/downstream")
    @Operation(summary = "Downstream highlight",
            description = "Returns the sorted ids and src->dst edge keys"
                    + " reachable from startId.")
    public ResponseEntity<DownstreamResult> downstream(
            @RequestBody final DownstreamRequest request) {
        if (request.graph() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(flowGraphService.downstream(
                request.graph(), request.startId()));
    }

    /**
     * Finds a node by id or label fragment.
     *
     * @param request the graph and query
     * @return the first matching node, or 404
     */
    @PostMapping("/search")
    @Operation(summary = "Search a node",
            description = "Exact id or substring of the label; the first"
                    + " node in declaration order wins.")
    public ResponseEntity<?> search(@RequestBody final SearchRequest request) {
        if (request.graph() == null) {
            return ResponseEntity.badRequest().build();
        }
        return flowGraphService.search(request.graph(), request.query())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Exports the graph edges, or only the highlighted ones, as CSV.
     *
     * @param request the graph and optional highlighted edge keys
     * @return the CSV attachment
     */
    @PostMapping("/export/csv")
    @Operation(summary = "Export edges as CSV")
    public ResponseEntity<String> exportCsv(
            @RequestBody final ExportRequest request) {
        if (request.graph() == null) {
            return ResponseEntity.badRequest().build();
        }
        final String csv = flowGraphService.exportCsv(request.graph(),
                request.highlightedEdges());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\""
                                + EdgeCsvExporter.FILE_NAME + "\"")
                .contentType(new MediaType("text", "csv",
                        StandardCharsets.UTF_8))
                .body(csv);
    }

    private Map<String, Object> error(final FlowMdException e) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("errorCode", e.getErrorCode());
        if (e.getLine() != null) {
            body.put("line", e.getLine());
        }
        return body;
    }

    /**
     * Request body for parsing.
     *
     * @param text the FlowMD source
     * @param maxNodes the hard node limit, null for the configured one
     * @param preferredMaxNodes the advisory limit, null for the
     *        configured one
     */
    public record ParseRequest(String text, Integer maxNodes,
            Integer preferredMaxNodes) {}

    /**
     * Request body for the downstream highlight.
     *
     * @param graph the parsed graph
     * @param startId the start node id
     */
    public record DownstreamRequest(FlowGraph graph, String startId) {}

    /**
     * Request body for node search.
     *
     * @param graph the parsed graph
     * @param query the exact id or label fragment
     */
    public record SearchRequest(FlowGraph graph, String query) {}

    /**
     * Request body for CSV export.
     *
     * @param graph the parsed graph
     * @param highlightedEdges the highlighted edge keys, optional
     */
    public record ExportRequest(FlowGraph graph,
            List<String> highlightedEdges) {}
}
