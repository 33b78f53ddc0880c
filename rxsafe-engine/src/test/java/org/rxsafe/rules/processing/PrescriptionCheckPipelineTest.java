package org.rxsafe.rules.processing;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.rxsafe.rules.ReferenceFixtures;
import org.rxsafe.rules.conf.ConfigLoader;
import org.rxsafe.rules.normalize.NameNormalizer;
import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.CheckResult;
import org.rxsafe.rules.om.PrescriptionCheckRequest;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.om.Severity;
import org.rxsafe.rules.processing.aggregate.AlertAggregator;
import org.rxsafe.rules.processing.evaluate.ContraindicationEvaluator;
import org.rxsafe.rules.processing.evaluate.CrossAllergyEvaluator;
import org.rxsafe.rules.processing.evaluate.DuplicateTherapyEvaluator;
import org.rxsafe.rules.processing.evaluate.EvaluationContext;
import org.rxsafe.rules.processing.evaluate.InteractionEvaluator;
import org.rxsafe.rules.processing.evaluate.RuleEvaluator;
import org.rxsafe.rules.reference.ReferenceDataStore;

class PrescriptionCheckPipelineTest {

	private static ReferenceDataStore store;
	private static PrescriptionCheckPipeline sequential;
	private static PrescriptionCheckPipeline parallel;

	@BeforeAll
	static void setup() {
		store = ReferenceFixtures.bundled();
		sequential = pipeline(standardEvaluators(), false);
		parallel = pipeline(standardEvaluators(), true);
	}

	@AfterAll
	static void teardown() {
		sequential.close();
		parallel.close();
	}

	// --- helpers -------------------------------------------------------------

	private static List<RuleEvaluator> standardEvaluators() {
		List<RuleEvaluator> evaluators = new ArrayList<>();
		evaluators.add(new InteractionEvaluator(store));
		evaluators.add(new ContraindicationEvaluator(store));
		evaluators.add(new CrossAllergyEvaluator(store));
		evaluators.add(new DuplicateTherapyEvaluator(new LinkedHashSet<>(ConfigLoader.DEFAULT_DUPLICATE_THERAPY_CLASSES)));
		return evaluators;
	}

	private static PrescriptionCheckPipeline pipeline(List<RuleEvaluator> evaluators, boolean parallel) {
		return new PrescriptionCheckPipeline(new NameNormalizer(store), evaluators, new AlertAggregator(), parallel);
	}

	private static RuleEvaluator named(String name, Function<EvaluationContext, List<RawFinding>> fn) {
		return new RuleEvaluator() {
			@Override
			public String name() {
				return name;
			}

			@Override
			public List<RawFinding> evaluate(EvaluationContext ctx) {
				return fn.apply(ctx);
			}
		};
	}

	private static Alert only(CheckResult r) {
		assertTrue(r.isComplete());
		assertEquals(1, r.getAlerts().size(), () -> "alerts: " + r.getAlerts());
		return r.getAlerts().get(0);
	}

	// --- end-to-end scenarios ------------------------------------------------

	@Test
	void warfarin_with_ibuprofen_gives_one_merged_interaction() {
		CheckResult r = sequential
				.check(PrescriptionCheckRequest.builder().newDrug("Warfarin 5mg OD").currentDrug("ibuprofen").build());

		Alert a = only(r);
		assertEquals(AlertKind.INTERACTION, a.getKind());
		assertEquals(Severity.MAJOR, a.getSeverity());
		assertEquals("ibuprofen+warfarin", a.getKey().getSubject());
		assertEquals(List.of("DDI-001", "DDI-002"), a.getDetails().getRuleIds());
		assertTrue(a.isBlocking());
	}

	@Test
	void metformin_in_ckd_stage4_is_contraindicated() {
		CheckResult r = sequential
				.check(PrescriptionCheckRequest.builder().newDrug("metformin").condition("CKD Stage4").build());

		Alert a = only(r);
		assertEquals(AlertKind.CONTRAINDICATION, a.getKind());
		assertEquals(List.of("CI-001"), a.getDetails().getRuleIds());
		assertTrue(a.isOverrideRequiresReason());
	}

	@Test
	void penicillin_allergy_flags_amoxicillin() {
		CheckResult r = sequential
				.check(PrescriptionCheckRequest.builder().newDrug("amoxicillin").allergy("penicillin").build());

		Alert a = only(r);
		assertEquals(AlertKind.CROSS_ALLERGY, a.getKind());
		assertEquals("beta_lactams", a.getDetails().getGroupId());
	}

	@Test
	void two_nsaids_give_one_duplicate_therapy() {
		CheckResult r = sequential
				.check(PrescriptionCheckRequest.builder().newDrug("ibuprofen").newDrug("naproxen").build());

		Alert a = only(r);
		assertEquals(AlertKind.DUPLICATE_THERAPY, a.getKind());
		assertEquals(Severity.MODERATE, a.getSeverity());
	}

	@Test
	void unknown_drug_gives_informational_alert() {
		CheckResult r = sequential.check(PrescriptionCheckRequest.builder().newDrug("unknownbrandxyz").build());

		Alert a = only(r);
		assertEquals(AlertKind.UNRECOGNIZED, a.getKind());
		assertEquals("drug:unknownbrandxyz", a.getKey().getSubject());
		assertFalse(a.isBlocking());
		assertTrue(r.getHardAlerts().isEmpty());
	}

	@Test
	void renal_caution_by_egfr_requires_a_reason() {
		CheckResult r = sequential.check(PrescriptionCheckRequest.builder().newDrug("metformin").egfr(20.0).build());

		Alert a = only(r);
		assertEquals(AlertKind.RENAL, a.getKind());
		assertTrue(a.isOverrideRequiresReason());
	}

	@Test
	void class_allergy_outside_any_group_is_never_silent() {
		CheckResult r = sequential
				.check(PrescriptionCheckRequest.builder().newDrug("lisinopril").allergy("ACE inhibitor").build());

		assertEquals(1, r.getAlerts(AlertKind.ALLERGY).size());
		assertEquals(Severity.CRITICAL, r.getAlerts().get(0).getSeverity());
		assertEquals("allergy_class:ace_inhibitor",
				r.getAlerts(AlertKind.UNRECOGNIZED).get(0).getKey().getSubject());
	}

	@Test
	void unknown_allergy_gives_informational_alert() {
		CheckResult r = sequential
				.check(PrescriptionCheckRequest.builder().newDrug("paracetamol").allergy("Shellfish").build());

		Alert a = only(r);
		assertEquals("allergy:shellfish", a.getKey().getSubject());
	}

	@Test
	void empty_request_gives_no_alerts() {
		CheckResult r = sequential.check(PrescriptionCheckRequest.builder().build());
		assertTrue(r.isComplete());
		assertTrue(r.getAlerts().isEmpty());
	}

	// --- ordering and determinism --------------------------------------------

	private static PrescriptionCheckRequest busyRequest() {
		return PrescriptionCheckRequest.builder().newDrug("aspirin").newDrug("naproxen").newDrug("sertraline")
				.newDrug("mysterypill").currentDrug("warfarin").currentDrug("phenelzine").condition("peptic_ulcer")
				.condition("gout").allergy("sulfa").allergy("penicillin").age(72).egfr(25.0).build();
	}

	@Test
	void alerts_are_sorted_and_keys_unique() {
		List<Alert> alerts = sequential.check(busyRequest()).getAlerts();

		assertTrue(alerts.size() > 5);
		Set<String> keys = new HashSet<>();
		for (int i = 0; i < alerts.size(); i++) {
			assertTrue(keys.add(alerts.get(i).getKey().toString()), "duplicate key " + alerts.get(i).getKey());
			if (i > 0) {
				assertTrue(AlertAggregator.ORDER.compare(alerts.get(i - 1), alerts.get(i)) < 0);
			}
		}
		assertEquals(Severity.CRITICAL, alerts.get(0).getSeverity());
	}

	@Test
	void parallel_and_sequential_agree() {
		assertEquals(sequential.check(busyRequest()).getAlerts(), parallel.check(busyRequest()).getAlerts());
	}

	@Test
	void repeated_checks_are_identical() {
		assertEquals(sequential.check(busyRequest()).getAlerts(), sequential.check(busyRequest()).getAlerts());
	}

	// --- failure handling ----------------------------------------------------

	@Test
	void failing_evaluator_is_reported_and_others_still_run() {
		List<RuleEvaluator> evaluators = standardEvaluators();
		evaluators.add(named("broken", ctx -> {
			throw new IllegalStateException("boom");
		}));
		try (PrescriptionCheckPipeline p = pipeline(evaluators, false)) {
			CheckResult r = p
					.check(PrescriptionCheckRequest.builder().newDrug("warfarin").currentDrug("ibuprofen").build());

			assertTrue(r.isComplete());
			assertEquals(2, r.getAlerts().size());
			assertEquals(1, r.getAlerts(AlertKind.INTERACTION).size());
			assertEquals("evaluator:broken", r.getAlerts(AlertKind.UNRECOGNIZED).get(0).getKey().getSubject());
		}
	}

	@Test
	void slow_check_returns_alerts_unavailable() {
		RuleEvaluator slow = named("slow", ctx -> {
			try {
				Thread.sleep(5_000);
			} catch (InterruptedException ie) {
				Thread.currentThread().interrupt();
			}
			return List.of();
		});
		try (PrescriptionCheckPipeline p = pipeline(List.of(slow), false)) {
			long start = System.nanoTime();
			CheckResult r = p.check(PrescriptionCheckRequest.builder().newDrug("warfarin").build(),
					Duration.ofMillis(50));
			long tookMs = (System.nanoTime() - start) / 1_000_000;

			assertEquals(CheckResult.Status.ALERTS_UNAVAILABLE, r.getStatus());
			assertTrue(r.getAlerts().isEmpty());
			assertTrue(tookMs < 2_000, "took " + tookMs + " ms");
		}
	}

	@Test
	void fast_check_completes_within_timeout() {
		CheckResult r = sequential.check(
				PrescriptionCheckRequest.builder().newDrug("warfarin").currentDrug("ibuprofen").build(),
				Duration.ofSeconds(30));
		assertTrue(r.isComplete());
		assertEquals(1, r.getAlerts().size());
	}
}
