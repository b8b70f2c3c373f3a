package co.fanki.flowviz.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * Turns the web server off when the application runs as an MCP stdio
 * server or as the self-test.
 *
 * <p>Runs after the configuration files are loaded, so the decision is
 * taken on the resolved {@code mcp.server.stdio} and
 * {@code flowviz.selftest.enabled} values, wherever they were set.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class HeadlessModeEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    /** Name of the property source this processor adds. */
    static final String PROPERTY_SOURCE = "flowvizHeadlessMode";

    static final String WEB_APPLICATION_TYPE =
            "spring.main.web-application-type";

    @Override
    public void postProcessEnvironment(
            final ConfigurableEnvironment environment,
            final SpringApplication application) {

        final boolean stdio = environment.getProperty(
                "mcp.server.stdio", Boolean.class, false);
        final boolean selftest = environment.getProperty(
                "flowviz.selftest.enabled", Boolean.class, false);

        if (stdio || selftest) {
            environment.getPropertySources().addFirst(new MapPropertySource(
                    PROPERTY_SOURCE, Map.of(WEB_APPLICATION_TYPE, "none")));
        }
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
