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

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.CheckResult;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.om.PrescriptionCheckRequest;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.om.Severity;
import org.rxsafe.rules.normalize.NameNormalizer;
import org.rxsafe.rules.processing.aggregate.AlertAggregator;
import org.rxsafe.rules.processing.evaluate.EvaluationContext;
import org.rxsafe.rules.processing.evaluate.RuleEvaluator;
import org.rxsafe.rules.reference.ReferenceDataStore;
import org.rxsafe.rules.util.DoseText;
import org.rxsafe.rules.util.Logger;

/**
 * Runs one prescription check end to end: normalize names, run every
 * evaluator, aggregate.
 * <p>
 * Evaluators are isolated from each other. One that throws is logged and
 * replaced by an informational finding; the rest of the check still
 * completes. With {@code parallel} set the evaluators run on a parallel
 * stream; the aggregated output is the same either way.
 * <p>
 * {@link #check(PrescriptionCheckRequest, Duration)} bounds a check in time.
 * On expiry the caller receives {@link CheckResult.Status#ALERTS_UNAVAILABLE}
 * and falls back to manual review.
 */
public final class PrescriptionCheckPipeline implements AutoCloseable {

	private static final AtomicInteger WORKER_SEQ = new AtomicInteger();

	private final NameNormalizer normalizer;
	private final List<RuleEvaluator> evaluators;
	private final AlertAggregator aggregator;
	private final boolean parallel;
	private final ExecutorService timeoutPool;

	public PrescriptionCheckPipeline(NameNormalizer normalizer, List<RuleEvaluator> evaluators,
			AlertAggregator aggregator, boolean parallel) {
		this.normalizer = normalizer;
		this.evaluators = List.copyOf(evaluators);
		this.aggregator = aggregator;
		this.parallel = parallel;
		this.timeoutPool = Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "rxsafe-check-" + WORKER_SEQ.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

	public List<RuleEvaluator> getEvaluators() {
		return evaluators;
	}

	public boolean isParallel() {
		return parallel;
	}

	/**
	 * Run a check on the calling thread.
	 */
	public CheckResult check(PrescriptionCheckRequest request) {
		long start = System.nanoTime();

		List<NormalizedDrug> newDrugs = normalizer.normalizeAll(request.getNewDrugs());
		List<NormalizedDrug> currentDrugs = normalizer.normalizeAll(request.getCurrentDrugs());
		List<NormalizedDrug> allergens = normalizer.normalizeAllergens(new TreeSet<>(request.getAllergies()));

		Set<String> conditions = new TreeSet<>();
		for (String c : request.getConditions()) {
			String id = ReferenceDataStore.normalizeCondition(c);
			if (!id.isEmpty()) {
				conditions.add(id);
			}
		}

		EvaluationContext ctx = EvaluationContext.builder().newDrugs(newDrugs).currentDrugs(currentDrugs)
				.conditions(conditions).allergens(allergens).age(request.getAge()).gender(request.getGender())
				.egfr(request.getEgfr()).pregnant(request.isPregnant()).build();

		List<RawFinding> findings = new ArrayList<>(unrecognized(newDrugs, currentDrugs, allergens));

		Stream<RuleEvaluator> stream = parallel ? evaluators.parallelStream() : evaluators.stream();
		findings.addAll(stream.map(ev -> runIsolated(ev, ctx)).flatMap(List::stream).collect(Collectors.toList()));

		List<Alert> alerts = aggregator.aggregate(findings);
		Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

		if (Logger.isEnabled(Logger.Level.DEBUG)) {
			Logger.debug("Check new={} current={} conditions={} -> {} alert(s) in {} ms", request.getNewDrugs(),
					request.getCurrentDrugs(), conditions, alerts.size(), elapsed.toMillis());
			for (Alert a : alerts) {
				Logger.debug("  {} {} rules={}", a.getSeverity().label(), a.getKey(), a.getDetails().getRuleIds());
			}
		}

		return CheckResult.builder().status(CheckResult.Status.COMPLETE).alerts(alerts).newDrugs(newDrugs)
				.currentDrugs(currentDrugs).elapsed(elapsed).build();
	}

	/**
	 * Run a check with a time limit. Never blocks longer than {@code timeout};
	 * expiry, interruption or an unexpected failure all yield an
	 * "alerts unavailable" result.
	 */
	public CheckResult check(PrescriptionCheckRequest request, Duration timeout) {
		long start = System.nanoTime();
		Future<CheckResult> future = timeoutPool.submit(() -> check(request));
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException te) {
			future.cancel(true);
			Logger.warn("Check for {} timed out after {} ms; alerts unavailable, manual review required",
					request.getNewDrugs(), timeout.toMillis());
		} catch (InterruptedException ie) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			Logger.warn("Check for {} interrupted; alerts unavailable", request.getNewDrugs());
		} catch (ExecutionException ee) {
			Logger.error("Check for {} failed; alerts unavailable", ee.getCause(), request.getNewDrugs());
		}
		return CheckResult.unavailable(Duration.ofNanos(System.nanoTime() - start));
	}

	@Override
	public void close() {
		timeoutPool.shutdownNow();
	}

	// ------------------------------------------------------------------
	// Internals
	// ------------------------------------------------------------------

	private static List<RawFinding> runIsolated(RuleEvaluator ev, EvaluationContext ctx) {
		try {
			return ev.evaluate(ctx);
		} catch (RuntimeException ex) {
			Logger.error("Evaluator {} failed; its checks are missing from this result", ex, ev.name());
			return List.of(RawFinding.builder().key(AlertKey.of(AlertKind.UNRECOGNIZED, "evaluator:" + ev.name()))
					.severity(Severity.MINOR).title("Safety check unavailable: " + ev.name().replace('_', ' '))
					.message("The " + ev.name().replace('_', ' ')
							+ " check could not be completed. Review this prescription manually.")
					.details(AlertDetails.empty()).ruleId("").build());
		}
	}

	private static List<RawFinding> unrecognized(List<NormalizedDrug> newDrugs, List<NormalizedDrug> currentDrugs,
			List<NormalizedDrug> allergens) {
		List<RawFinding> out = new ArrayList<>();
		List<String> names = new ArrayList<>();
		for (NormalizedDrug d : newDrugs) {
			addUnrecognizedDrug(d, out, names);
		}
		for (NormalizedDrug d : currentDrugs) {
			addUnrecognizedDrug(d, out, names);
		}
		for (NormalizedDrug a : allergens) {
			if (a.isRecognized()) {
				continue;
			}
			String shown = a.getDisplayName();
			names.add(shown);
			out.add(RawFinding.builder().key(AlertKey.of(AlertKind.UNRECOGNIZED, "allergy:" + DoseText.normalizeKey(shown)))
					.severity(Severity.MINOR).title("Unrecognized allergy: " + shown)
					.message("No cross-allergy data available for '" + shown + "'. Check new medicines against it manually.")
					.details(AlertDetails.builder().allergen(shown).build()).ruleId("").build());
		}
		if (!names.isEmpty()) {
			Logger.warn("Unrecognized names in check: {}", names);
		}
		return out;
	}

	private static void addUnrecognizedDrug(NormalizedDrug d, List<RawFinding> out, List<String> names) {
		if (d.isRecognized()) {
			return;
		}
		String shown = d.getDisplayName();
		if (shown.isEmpty()) {
			return;
		}
		names.add(shown);
		out.add(RawFinding.builder().key(AlertKey.of(AlertKind.UNRECOGNIZED, "drug:" + DoseText.normalizeKey(shown)))
				.severity(Severity.MINOR).title("Unrecognized drug: " + shown)
				.message("No interaction or contraindication data available for '" + shown
						+ "'. Review it manually.")
				.details(AlertDetails.builder().drugs(List.of(shown)).build()).ruleId("").build());
	}
}
