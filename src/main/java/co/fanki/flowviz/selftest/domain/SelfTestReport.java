package co.fanki.flowviz.selftest.domain;

import java.util.List;

/**
 * Summary of a self-test run.
 *
 * @param generatedAt the UTC timestamp, {@code yyyy-MM-ddTHH:mm:ssZ}
 * @param passed the number of passing cases
 * @param total the number of cases
 * @param results one outcome per case, in index order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SelfTestReport(
        String generatedAt,
        int passed,
        int total,
        List<TestOutcome> results) {}
