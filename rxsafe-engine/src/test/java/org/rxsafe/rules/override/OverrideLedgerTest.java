package org.rxsafe.rules.override;

/*
 * This file is part of RxSafe.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * RxSafe is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * RxSafe is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with RxSafe.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.OverrideDecision;
import org.rxsafe.rules.om.OverrideRecord;
import org.rxsafe.rules.om.Severity;

class OverrideLedgerTest {

	private static final Instant NOW = Instant.parse("2024-03-01T09:30:00Z");

	private static final Alert CRITICAL = alert(AlertKey.forPair(AlertKind.INTERACTION, "sertraline", "tramadol"),
			Severity.CRITICAL, true, true, "DDI-008");
	private static final Alert MAJOR = alert(AlertKey.forPair(AlertKind.INTERACTION, "ibuprofen", "warfarin"),
			Severity.MAJOR, true, false, "DDI-001");
	private static final Alert ABSOLUTE = alert(AlertKey.forPair(AlertKind.INTERACTION, "phenelzine", "sertraline"),
			Severity.CRITICAL, false, true, "DDI-005");
	private static final Alert DUPLICATE = alert(AlertKey.of(AlertKind.DUPLICATE_THERAPY, "nsaid"),
			Severity.MODERATE, true, false, null);
	private static final Alert UNKNOWN = alert(AlertKey.of(AlertKind.UNRECOGNIZED, "drug:xyz"), Severity.MINOR, true,
			false, null);

	private final List<OverrideRecord> audited = Collections.synchronizedList(new ArrayList<>());
	private OverrideLedger ledger;

	@BeforeEach
	void setup() {
		audited.clear();
		ledger = new OverrideLedger((tx, rec) -> audited.add(rec), Clock.fixed(NOW, ZoneOffset.UTC));
	}

	// --- helpers -------------------------------------------------------------

	private static Alert alert(AlertKey key, Severity severity, boolean canOverride, boolean requiresReason,
			String ruleId) {
		AlertDetails details = AlertDetails.builder().ruleIds(ruleId == null ? List.of() : List.of(ruleId)).build();
		return Alert.builder().key(key).severity(severity).title(key.toString()).message(key.toString())
				.details(details).canOverride(canOverride).overrideRequiresReason(requiresReason).build();
	}

	private OverrideTransaction open(Alert... alerts) {
		return ledger.open("P-1", "V-1", "RX-1", "dr.rao", List.of(alerts));
	}

	// --- decisions -----------------------------------------------------------

	@Test
	void proceeding_without_required_reason_is_rejected() {
		OverrideTransaction tx = open(CRITICAL);

		MissingReasonException ex = assertThrows(MissingReasonException.class,
				() -> ledger.record(tx, CRITICAL, OverrideDecision.PROCEEDED, "   "));
		assertSame(CRITICAL, ex.getAlert());
		assertTrue(tx.getRecords().isEmpty());
		assertTrue(audited.isEmpty());
	}

	@Test
	void proceeding_with_reason_is_recorded() throws Exception {
		OverrideTransaction tx = open(CRITICAL);

		OverrideRecord rec = ledger.record(tx, CRITICAL, OverrideDecision.PROCEEDED, "  Consulted specialist ");

		assertEquals(1L, rec.getSequence());
		assertEquals("Consulted specialist", rec.getReason());
		assertEquals(NOW, rec.getTimestamp());
		assertEquals("dr.rao", rec.getClinicianId());
		assertEquals(Severity.CRITICAL, rec.getSeverity());
		assertEquals(List.of("DDI-008"), rec.getRuleIds());
		assertEquals(List.of(rec), tx.getRecords());
		assertEquals(List.of(rec), audited);
	}

	@Test
	void absolute_alert_cannot_be_overridden() {
		OverrideTransaction tx = open(ABSOLUTE);

		assertThrows(BlockedDecisionException.class,
				() -> ledger.record(tx, ABSOLUTE, OverrideDecision.PROCEEDED, "Benefit outweighs risk"));
		assertFalse(tx.isClearedToSave());
	}

	@Test
	void cancelling_needs_no_reason() throws Exception {
		OverrideTransaction tx = open(ABSOLUTE, CRITICAL);

		OverrideRecord rec = ledger.record(tx, ABSOLUTE, OverrideDecision.CANCELLED, null);
		assertEquals("", rec.getReason());
		assertEquals(OverrideDecision.CANCELLED, rec.getDecision());
	}

	@Test
	void major_alert_may_proceed_without_reason() throws Exception {
		OverrideTransaction tx = open(MAJOR);

		ledger.record(tx, MAJOR, OverrideDecision.PROCEEDED, "");
		assertTrue(tx.isClearedToSave());
	}

	@Test
	void alert_from_another_check_is_refused() {
		OverrideTransaction tx = open(MAJOR);
		assertThrows(IllegalArgumentException.class,
				() -> ledger.record(tx, CRITICAL, OverrideDecision.PROCEEDED, "Consulted specialist"));
	}

	// --- save gate -----------------------------------------------------------

	@Test
	void save_requires_every_blocking_alert_to_proceed() throws Exception {
		OverrideTransaction tx = open(CRITICAL, MAJOR, DUPLICATE, UNKNOWN);

		assertEquals(List.of(CRITICAL, MAJOR), tx.pendingBlockingAlerts());
		IllegalStateException ex = assertThrows(IllegalStateException.class, tx::requireClearedToSave);
		assertTrue(ex.getMessage().contains("RX-1 has 2 unresolved"));

		ledger.record(tx, MAJOR, OverrideDecision.PROCEEDED, null);
		ledger.record(tx, CRITICAL, OverrideDecision.PROCEEDED, "Benefit outweighs risk");

		assertTrue(tx.isClearedToSave());
		tx.requireClearedToSave();
	}

	@Test
	void latest_decision_wins() throws Exception {
		OverrideTransaction tx = open(MAJOR);

		ledger.record(tx, MAJOR, OverrideDecision.PROCEEDED, null);
		ledger.record(tx, MAJOR, OverrideDecision.CANCELLED, null);

		assertEquals(OverrideDecision.CANCELLED, tx.latestFor(MAJOR.getKey()).get().getDecision());
		assertFalse(tx.isClearedToSave());
		assertEquals(2, tx.getRecords().size());
		assertEquals(2L, tx.getRecords().get(1).getSequence());
	}

	@Test
	void transaction_without_blocking_alerts_is_cleared() {
		assertTrue(open(DUPLICATE, UNKNOWN).isClearedToSave());
		assertTrue(open().isClearedToSave());
	}

	// --- audit sink ----------------------------------------------------------

	@Test
	void failing_sink_leaves_transaction_unchanged() {
		OverrideLedger failing = new OverrideLedger((tx, rec) -> {
			throw new IllegalStateException("audit store down");
		}, Clock.fixed(NOW, ZoneOffset.UTC));
		OverrideTransaction tx = failing.open("P-1", "V-1", "RX-1", "dr.rao", List.of(MAJOR));

		assertThrows(IllegalStateException.class, () -> failing.record(tx, MAJOR, OverrideDecision.PROCEEDED, null));
		assertTrue(tx.getRecords().isEmpty());
		assertFalse(tx.isClearedToSave());
	}

	@Test
	void default_logging_sink_accepts_records() throws Exception {
		OverrideLedger logging = new OverrideLedger();
		OverrideTransaction tx = logging.open("P-9", "V-9", "RX-9", "dr.iyer", List.of(CRITICAL));
		logging.record(tx, CRITICAL, OverrideDecision.PROCEEDED, "Emergency situation");
		assertEquals(1, tx.getRecords().size());
	}

	// --- concurrency ---------------------------------------------------------

	@Test
	void concurrent_decisions_get_unique_sequences() throws Exception {
		OverrideTransaction tx = open(MAJOR, DUPLICATE);
		int threads = 8;
		int perThread = 25;
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		CountDownLatch go = new CountDownLatch(1);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < threads; t++) {
				Alert target = (t % 2 == 0) ? MAJOR : DUPLICATE;
				futures.add(pool.submit(() -> {
					go.await();
					for (int i = 0; i < perThread; i++) {
						ledger.record(tx, target, OverrideDecision.PROCEEDED, "Patient preference after counseling");
					}
					return null;
				}));
			}
			go.countDown();
			for (Future<?> f : futures) {
				f.get(30, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		List<OverrideRecord> records = tx.getRecords();
		assertEquals(threads * perThread, records.size());
		Set<Long> seqs = new HashSet<>();
		for (int i = 0; i < records.size(); i++) {
			assertEquals(i + 1L, records.get(i).getSequence());
			seqs.add(records.get(i).getSequence());
		}
		assertEquals(threads * perThread, seqs.size());
		assertEquals(records, audited);
	}

	@Test
	void transactions_do_not_share_state() throws Exception {
		OverrideTransaction first = open(MAJOR);
		OverrideTransaction second = open(MAJOR);

		ledger.record(first, MAJOR, OverrideDecision.PROCEEDED, null);

		assertTrue(first.isClearedToSave());
		assertFalse(second.isClearedToSave());
		assertTrue(second.getRecords().isEmpty());
	}

	@Test
	void common_reasons_are_offered() {
		assertTrue(OverrideReasons.COMMON.contains("Benefit outweighs risk"));
		assertEquals(7, OverrideReasons.COMMON.size());
	}
}
