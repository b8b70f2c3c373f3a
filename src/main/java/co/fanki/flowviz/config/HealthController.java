package co.fanki.flowviz.config;

import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check for the viewer and the launcher scripts.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final FlowMdParser parser;

    /**
     * Creates a new HealthController.
     *
     * @param theParser the configured parser, whose limits are reported
     */
    public HealthController(final FlowMdParser theParser) {
        this.parser = theParser;
    }

    /**
     * Returns the status and the node limits the parser runs with.
     *
     * @return {@code status: up} plus {@code maxNodes} and
     *         {@code preferredMaxNodes}
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "up");
        body.put("maxNodes", parser.maxNodes());
        body.put("preferredMaxNodes", parser.preferredMaxNodes());
        return body;
    }
}
