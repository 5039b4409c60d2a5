package io.github.hongjungwan.avl.test;

import io.github.hongjungwan.avl.api.domain.LedgerRecord;
import io.github.hongjungwan.avl.api.domain.VerificationReport;

/**
 * TestKit 진입점. {@code import static io.github.hongjungwan.avl.test.AvlAssertions.assertThat;}
 */
public final class AvlAssertions {

    private AvlAssertions() {}

    public static LedgerAssert assertThat(LedgerRecord actual) {
        return new LedgerAssert(actual);
    }

    public static VerificationReportAssert assertThat(VerificationReport actual) {
        return new VerificationReportAssert(actual);
    }
}
