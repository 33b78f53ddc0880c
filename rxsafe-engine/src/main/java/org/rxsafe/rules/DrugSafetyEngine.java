package org.rxsafe.rules;

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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.rxsafe.rules.conf.ConfigLoader;
import org.rxsafe.rules.normalize.NameNormalizer;
import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.CheckResult;
import org.rxsafe.rules.om.InteractionRule;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.om.OverrideDecision;
import org.rxsafe.rules.om.OverrideRecord;
import org.rxsafe.rules.om.PrescriptionCheckRequest;
import org.rxsafe.rules.override.OverrideLedger;
import org.rxsafe.rules.override.OverrideRejectedException;
import org.rxsafe.rules.override.OverrideTransaction;
import org.rxsafe.rules.processing.PrescriptionCheckPipeline;
import org.rxsafe.rules.processing.aggregate.AlertAggregator;
import org.rxsafe.rules.processing.evaluate.ContraindicationEvaluator;
import org.rxsafe.rules.processing.evaluate.CrossAllergyEvaluator;
import org.rxsafe.rules.processing.evaluate.DuplicateTherapyEvaluator;
import org.rxsafe.rules.processing.evaluate.InteractionEvaluator;
import org.rxsafe.rules.processing.evaluate.RuleEvaluator;
import org.rxsafe.rules.reference.DataLoadException;
import org.rxsafe.rules.reference.ReferenceDataLoader;
import org.rxsafe.rules.reference.ReferenceDataStore;
import org.rxsafe.rules.reference.ReferenceSources;
import org.rxsafe.rules.util.Logger;

/**
 * Entry point for embedding the rule engine.
 * <p>
 * Typical use from a prescription screen:
 *
 * <pre>
 * DrugSafetyEngine engine = DrugSafetyEngine.start(new ConfigLoader());
 * CheckResult result = engine.check(request);
 * OverrideTransaction tx = engine.openTransaction(patientId, visitId, rxId, clinicianId, result);
 * // for each blocking alert the clinician decides:
 * engine.recordDecision(tx, alert, OverrideDecision.PROCEEDED, reason);
 * tx.requireClearedToSave();
 * </pre>
 */
public final class DrugSafetyEngine implements AutoCloseable {

	private final ReferenceDataStore store;
	private final NameNormalizer normalizer;
	private final PrescriptionCheckPipeline pipeline;
	private final OverrideLedger ledger;
	private final Duration timeout;

	private DrugSafetyEngine(ReferenceDataStore store, ConfigLoader cfg, OverrideLedger ledger) {
		this.store = store;
		this.normalizer = new NameNormalizer(store);
		List<RuleEvaluator> evaluators = List.of(new InteractionEvaluator(store), new ContraindicationEvaluator(store),
				new CrossAllergyEvaluator(store), new DuplicateTherapyEvaluator(cfg.getDuplicateTherapyClasses()));
		this.pipeline = new PrescriptionCheckPipeline(normalizer, evaluators, new AlertAggregator(),
				cfg.isParallelEvaluation());
		this.ledger = ledger;
		this.timeout = Duration.ofMillis(cfg.getCheckTimeoutMillis());
	}

	/**
	 * Validate configuration and load reference data.
	 *
	 * @throws DataLoadException     reference data is missing, malformed or
	 *                               inconsistent
	 * @throws IllegalStateException the configuration itself is invalid
	 */
	public static DrugSafetyEngine start(ConfigLoader cfg) throws DataLoadException {
		List<String> problems = new ArrayList<>();
		for (String issue : cfg.validate()) {
			if (issue.startsWith("Warning:")) {
				Logger.warn(issue);
			} else {
				Logger.error(issue);
				problems.add(issue);
			}
		}
		if (!problems.isEmpty()) {
			throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
		}

		ReferenceDataStore store = ReferenceDataLoader.load(ReferenceSources.fromConfig(cfg));
		List<String> unknownClasses = unknownClassTags(store, cfg.getDuplicateTherapyClasses());
		if (!unknownClasses.isEmpty()) {
			Logger.warn("DUPLICATE_THERAPY_CLASSES lists class tags the reference data does not define: {}",
					unknownClasses);
		}
		DrugSafetyEngine engine = new DrugSafetyEngine(store, cfg, new OverrideLedger());
		Logger.info("Drug safety engine ready: parallel={}, timeout={} ms", engine.pipeline.isParallel(),
				engine.timeout.toMillis());
		return engine;
	}

	/** Configured tags that no drug in the store carries; they can never match. */
	static List<String> unknownClassTags(ReferenceDataStore store, Collection<String> tags) {
		List<String> out = new ArrayList<>();
		for (String tag : tags) {
			if (!store.isClassTag(tag)) {
				out.add(tag);
			}
		}
		return out;
	}

	/** Engine over an already loaded store. */
	public static DrugSafetyEngine create(ReferenceDataStore store, ConfigLoader cfg, OverrideLedger ledger) {
		return new DrugSafetyEngine(store, cfg, ledger);
	}

	/** Check a prescription within the configured time limit. */
	public CheckResult check(PrescriptionCheckRequest request) {
		return pipeline.check(request, timeout);
	}

	public CheckResult check(PrescriptionCheckRequest request, Duration limit) {
		return pipeline.check(request, limit);
	}

	public OverrideTransaction openTransaction(String patientId, String visitId, String prescriptionId,
			String clinicianId, CheckResult result) {
		return ledger.open(patientId, visitId, prescriptionId, clinicianId, result.getAlerts());
	}

	public OverrideRecord recordDecision(OverrideTransaction tx, Alert alert, OverrideDecision decision, String reason)
			throws OverrideRejectedException {
		return ledger.record(tx, alert, decision, reason);
	}

	/**
	 * The alert's suggested alternatives that have no known interaction with
	 * any of the patient's current drugs. Drug ids, in the order listed by the
	 * rule.
	 */
	public List<String> saferAlternatives(Alert alert, Collection<String> currentDrugs) {
		List<NormalizedDrug> current = normalizer.normalizeAll(currentDrugs);
		List<String> out = new ArrayList<>();
		for (String alt : alert.getDetails().getAlternatives()) {
			boolean clean = true;
			for (NormalizedDrug c : current) {
				if (!c.isDrug()) {
					continue;
				}
				List<InteractionRule> hits = store.lookupInteractions(alt, c.getCanonicalId());
				if (!hits.isEmpty()) {
					if (Logger.isEnabled(Logger.Level.DEBUG)) {
						List<String> ids = new ArrayList<>();
						hits.forEach(r -> ids.add(r.getRuleId()));
						Logger.debug("Alternative {} interacts with current drug {}: {}", alt, c.getCanonicalId(), ids);
					}
					clean = false;
					break;
				}
			}
			if (clean) {
				out.add(alt);
			}
		}
		return out;
	}

	public ReferenceDataStore getStore() {
		return store;
	}

	public NameNormalizer getNormalizer() {
		return normalizer;
	}

	public PrescriptionCheckPipeline getPipeline() {
		return pipeline;
	}

	public OverrideLedger getLedger() {
		return ledger;
	}

	public Duration getTimeout() {
		return timeout;
	}

	@Override
	public void close() {
		pipeline.close();
	}
}
