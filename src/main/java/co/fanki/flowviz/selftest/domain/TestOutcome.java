package co.fanki.flowviz.selftest.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one self-test case.
 *
 * @param id the case id
 * @param description the case description
 * @param success whether every expectation held
 * @param message why the case failed, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestOutcome(
        String id,
        String description,
        boolean success,
        String message) {

    static TestOutcome passed(final TestCase testCase) {
        return new TestOutcome(testCase.id(), testCase.description(),
                true, null);
    }

    static TestOutcome failed(final TestCase testCase,
            final String message) {
        return new TestOutcome(testCase.id(), testCase.description(),
                false, message);
    }
}
