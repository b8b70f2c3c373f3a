package co.fanki.flowviz.selftest.application;

import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import co.fanki.flowviz.selftest.domain.SelfTestReport;
import co.fanki.flowviz.selftest.domain.TestCase;
import co.fanki.flowviz.selftest.domain.TestCaseEvaluator;
import co.fanki.flowviz.selftest.domain.TestOutcome;
import co.fanki.flowviz.shared.DomainException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives the fixture suite through the FlowMD core.
 *
 * <p>Fixtures live under a configurable location: an {@code index.json}
 * array names the case files, each case file holds one
 * {@link TestCase}. The run produces a {@link SelfTestReport} that is
 * also written, pretty printed, to the configured report path.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class SelfTestService {

    private static final Logger LOG = LoggerFactory.getLogger(
            SelfTestService.class);

    private static final String INDEX = "index.json";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
            .withZone(ZoneOffset.UTC);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final TestCaseEvaluator evaluator;
    private final String location;
    private final Path reportPath;

    /**
     * Creates a new SelfTestService.
     *
     * @param theResourceLoader loads the fixture files
     * @param theObjectMapper reads fixtures and writes the report
     * @param parser the configured FlowMD parser
     * @param theLocation the fixture directory, e.g.
     *        {@code classpath:selftest/testcases/}
     * @param theReportPath where the report is written
     */
    public SelfTestService(final ResourceLoader theResourceLoader,
            final ObjectMapper theObjectMapper,
            final FlowMdParser parser,
            @Value("${flowviz.selftest.location:classpath:selftest/testcases/}")
            final String theLocation,
            @Value("${flowviz.selftest.report:logs/test-report.json}")
            final String theReportPath) {
        this.resourceLoader = theResourceLoader;
        this.objectMapper = theObjectMapper;
        this.evaluator = new TestCaseEvaluator(parser);
        this.location = theLocation.endsWith("/")
                ? theLocation : theLocation + "/";
        this.reportPath = Path.of(theReportPath);
    }

    /**
     * Runs every indexed case and writes the report.
     *
     * @return the report
     * @throws DomainException if the fixtures cannot be read or the
     *         report cannot be written
     */
    public SelfTestReport run() {
        final List<String> caseFiles = readValue(INDEX,
                new TypeReference<List<String>>() {});

        LOG.info("Starting selftest with {} cases", caseFiles.size());

        final List<TestOutcome> results = new ArrayList<>();
        int passed = 0;
        for (final String caseFile : caseFiles) {
            final TestCase testCase = readValue(caseFile,
                    new TypeReference<TestCase>() {});
            final TestOutcome outcome = evaluator.evaluate(testCase);
            if (outcome.success()) {
                passed++;
            } else {
                LOG.warn("Selftest case {} failed: {}", testCase.id(),
                        outcome.message());
            }
            results.add(outcome);
        }

        final SelfTestReport report = new SelfTestReport(
                TIMESTAMP.format(Instant.now().truncatedTo(ChronoUnit.SECONDS)),
                passed, results.size(), List.copyOf(results));

        write(report);
        LOG.info("Selftest {}/{}", passed, results.size());
        return report;
    }

    /**
     * Returns the path the report is written to.
     *
     * @return the report path
     */
    public Path reportPath() {
        return reportPath;
    }

    private <T> T readValue(final String name,
            final TypeReference<T> type) {
        final Resource resource = resourceLoader.getResource(location + name);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (final IOException e) {
            throw new DomainException("Cannot read selftest fixture "
                    + location + name + ": " + e.getMessage(),
                    "SELFTEST_FIXTURE", e);
        }
    }

    private void write(final SelfTestReport report) {
        try {
            final Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(reportPath.toFile(), report);
        } catch (final IOException e) {
            throw new DomainException("Cannot write selftest report "
                    + reportPath + ": " + e.getMessage(),
                    "SELFTEST_REPORT", e);
        }
    }
}
