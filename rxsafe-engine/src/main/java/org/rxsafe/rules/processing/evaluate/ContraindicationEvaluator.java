package org.rxsafe.rules.processing.evaluate;

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

import java.util.ArrayList;
import java.util.List;

import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.ContraindicationRule;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.om.Severity;
import org.rxsafe.rules.reference.ReferenceDataStore;

/**
 * Drug-disease contraindications, including the renal, pregnancy and
 * geriatric qualified rules.
 * <p>
 * A qualified rule fires on its condition like any other rule, and also when
 * the patient's labs or demographics cross the rule's threshold:
 * <ul>
 * <li>RENAL: eGFR present and below the threshold</li>
 * <li>PREGNANCY: pregnancy flag set</li>
 * <li>GERIATRIC: age at or above the threshold</li>
 * </ul>
 * Conditions that no rule references are reported once each as an
 * informational finding so the coverage gap is visible.
 */
public final class ContraindicationEvaluator implements RuleEvaluator {

	private final ReferenceDataStore store;

	public ContraindicationEvaluator(ReferenceDataStore store) {
		this.store = store;
	}

	@Override
	public String name() {
		return "contraindication";
	}

	@Override
	public List<RawFinding> evaluate(EvaluationContext ctx) {
		List<RawFinding> out = new ArrayList<>();

		for (String condition : ctx.getConditions()) {
			if (!store.isKnownCondition(condition)) {
				out.add(unknownCondition(condition));
			}
		}

		for (NormalizedDrug drug : ctx.getRecognizedNewDrugs()) {
			for (ContraindicationRule rule : store.contraindicationsFor(drug.getCanonicalId())) {
				String trigger = trigger(rule, ctx);
				if (trigger != null) {
					out.add(toFinding(drug, rule, trigger));
				}
			}
		}
		return out;
	}

	/**
	 * @return a short description of what made the rule fire, or null if it
	 *         does not apply to this patient
	 */
	static String trigger(ContraindicationRule rule, EvaluationContext ctx) {
		if (ctx.getConditions().contains(rule.getCondition())) {
			return rule.getCondition();
		}
		if (rule.getThreshold() == null && rule.getQualifier().requiresThreshold()) {
			return null;
		}
		switch (rule.getQualifier()) {
		case RENAL:
			if (ctx.getEgfr() != null && ctx.getEgfr() < rule.getThreshold()) {
				return "eGFR " + number(ctx.getEgfr()) + " below " + number(rule.getThreshold());
			}
			return null;
		case PREGNANCY:
			return ctx.isPregnant() ? "pregnancy" : null;
		case GERIATRIC:
			if (ctx.getAge() >= rule.getThreshold()) {
				return "age " + ctx.getAge() + " (" + number(rule.getThreshold()) + " or over)";
			}
			return null;
		default:
			return null;
		}
	}

	private static RawFinding toFinding(NormalizedDrug drug, ContraindicationRule rule, String trigger) {
		AlertKind kind = rule.getQualifier().getAlertKind();
		String title;
		switch (kind) {
		case RENAL:
			title = "Renal caution: " + drug.getDisplayName();
			break;
		case PREGNANCY:
			title = "Pregnancy caution: " + drug.getDisplayName();
			break;
		case GERIATRIC:
			title = "Geriatric caution: " + drug.getDisplayName();
			break;
		default:
			title = drug.getDisplayName() + " contraindicated: " + rule.getCondition();
			break;
		}
		String message = rule.getReason().isEmpty() ? "Contraindicated with " + trigger
				: rule.getReason() + " (" + trigger + ")";

		AlertDetails details = AlertDetails.builder().condition(rule.getCondition())
				.alternatives(rule.getAlternatives()).drugs(List.of(drug.getDisplayName()))
				.ruleIds(List.of(rule.getRuleId())).build();

		return RawFinding.builder().key(AlertKey.forCondition(kind, drug.getCanonicalId(), rule.getCondition()))
				.severity(rule.getSeverity()).absolute(rule.isAbsolute()).title(title).message(message)
				.details(details).ruleId(rule.getRuleId()).build();
	}

	private static RawFinding unknownCondition(String condition) {
		return RawFinding.builder().key(AlertKey.of(AlertKind.UNRECOGNIZED, "condition:" + condition))
				.severity(Severity.MINOR).title("Unrecognized condition: " + condition)
				.message("No contraindication data available for condition '" + condition
						+ "'. Review medicines against it manually.")
				.details(AlertDetails.builder().condition(condition).build()).ruleId("").build();
	}

	private static String number(double v) {
		return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
	}
}
