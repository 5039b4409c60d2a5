/**
 * Public API for the Autonomous Verification Ledger.
 *
 * <p>This package contains the interfaces and classes that producers and
 * consumers interact with directly.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.avl.api.VerificationLedger} - append, query and verify</li>
 *   <li>{@link io.github.hongjungwan.avl.api.VerificationLedgerFactory} - builds a ledger from configuration</li>
 *   <li>{@link io.github.hongjungwan.avl.api.config.AvlConfig} - ledger configuration</li>
 *   <li>{@link io.github.hongjungwan.avl.api.domain.VerificationReport} - verification result</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * VerificationLedger ledger = VerificationLedgerFactory.create(
 *         AvlConfig.durableConfig("jdbc:postgresql://db/avl", "avl", secret));
 * ledger.start();
 *
 * ledger.append(DraftRecord.of("regime-7", "threshold-service", CoreKind.THRESHOLD_APPLIED)
 *         .payload(Map.of("threshold", 42, "confidence", 0.93))
 *         .build());
 *
 * VerificationReport report = ledger.verify("regime-7");
 * if (!report.isValid()) {
 *     alert(report.getBrokenAt());
 * }
 * }</pre>
 */
package io.github.hongjungwan.avl.api;
