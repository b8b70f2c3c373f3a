package co.fanki.flowviz.config;

import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the FlowMD parser with the configured node limits.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ParserConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ParserConfiguration.class);

    /**
     * Creates the default parser.
     *
     * @param maxNodes the hard node limit
     * @param preferredMaxNodes the advisory node limit
     * @return the parser
     */
    @Bean
    public FlowMdParser flowMdParser(
            @Value("${flowviz.parser.max-nodes:1000}") final int maxNodes,
            @Value("${flowviz.parser.preferred-max-nodes:300}")
            final int preferredMaxNodes) {
        LOG.info("FlowMD parser limits: max {} nodes, preferred {}",
                maxNodes, preferredMaxNodes);
        return new FlowMdParser(maxNodes, preferredMaxNodes);
    }

}
