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

import org.apache.commons.lang3.StringUtils;
import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.InteractionRule;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.reference.ReferenceDataStore;

/**
 * Pairwise drug-drug interactions. Every new-new and new-current pair is
 * checked; current-current pairs were accepted at an earlier visit and are not
 * re-flagged. A finding carries the literal pair even when the rule matched
 * through a class tag.
 */
public final class InteractionEvaluator implements RuleEvaluator {

	private final ReferenceDataStore store;

	public InteractionEvaluator(ReferenceDataStore store) {
		this.store = store;
	}

	@Override
	public String name() {
		return "interaction";
	}

	@Override
	public List<RawFinding> evaluate(EvaluationContext ctx) {
		List<RawFinding> out = new ArrayList<>();
		List<NormalizedDrug> fresh = ctx.getRecognizedNewDrugs();
		List<NormalizedDrug> current = ctx.getRecognizedCurrentDrugs();

		for (int i = 0; i < fresh.size(); i++) {
			NormalizedDrug a = fresh.get(i);
			for (int j = i + 1; j < fresh.size(); j++) {
				checkPair(a, fresh.get(j), out);
			}
			for (NormalizedDrug c : current) {
				checkPair(a, c, out);
			}
		}
		return out;
	}

	private void checkPair(NormalizedDrug a, NormalizedDrug b, List<RawFinding> out) {
		if (a.getCanonicalId().equals(b.getCanonicalId())) {
			return;
		}
		for (InteractionRule rule : store.lookupInteractions(a.getCanonicalId(), b.getCanonicalId())) {
			out.add(toFinding(a, b, rule));
		}
	}

	private static RawFinding toFinding(NormalizedDrug a, NormalizedDrug b, InteractionRule rule) {
		String title = a.getDisplayName() + " + " + b.getDisplayName();
		String message = StringUtils.defaultIfBlank(rule.getClinicalEffect(), StringUtils.defaultString(rule.getMechanism()));

		AlertDetails details = AlertDetails.builder()
				.mechanism(StringUtils.defaultString(rule.getMechanism()))
				.clinicalEffect(StringUtils.defaultString(rule.getClinicalEffect()))
				.management(StringUtils.defaultString(rule.getManagement()))
				.evidence(rule.getEvidence()).drugs(List.of(a.getDisplayName(), b.getDisplayName()))
				.ruleIds(List.of(rule.getRuleId())).build();

		return RawFinding.builder().key(AlertKey.forPair(AlertKind.INTERACTION, a.getCanonicalId(), b.getCanonicalId()))
				.severity(rule.getSeverity()).evidence(rule.getEvidence()).absolute(rule.isAbsolute())
				.title("Interaction: " + title).message(message).details(details).ruleId(rule.getRuleId()).build();
	}
}
