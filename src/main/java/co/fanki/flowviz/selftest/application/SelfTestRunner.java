package co.fanki.flowviz.selftest.application;

import co.fanki.flowviz.selftest.domain.SelfTestReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the selftest at startup and prints the report to stdout.
 *
 * <p>Opt-in via {@code flowviz.selftest.enabled=true}, which the
 * {@code --selftest} command line flag sets.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "flowviz.selftest.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class SelfTestRunner implements CommandLineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            SelfTestRunner.class);

    private final SelfTestService selfTestService;
    private final ObjectMapper objectMapper;

    /**
     * Creates a new SelfTestRunner.
     *
     * @param theSelfTestService the selftest service
     * @param theObjectMapper renders the report
     */
    public SelfTestRunner(final SelfTestService theSelfTestService,
            final ObjectMapper theObjectMapper) {
        this.selfTestService = theSelfTestService;
        this.objectMapper = theObjectMapper;
    }

    @Override
    public void run(final String... args) throws Exception {
        final SelfTestReport report = selfTestService.run();
        LOG.info("Selftest report written to {}",
                selfTestService.reportPath().toAbsolutePath());
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(report));
    }
}
