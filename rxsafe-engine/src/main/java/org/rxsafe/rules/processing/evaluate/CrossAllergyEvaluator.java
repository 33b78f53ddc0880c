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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.CrossAllergyGroup;
import org.rxsafe.rules.om.EvidenceLevel;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.om.Severity;
import org.rxsafe.rules.om.SubjectType;
import org.rxsafe.rules.reference.CrossAllergyMatch;
import org.rxsafe.rules.reference.ReferenceDataStore;

/**
 * Declared allergies against new drugs. The same drug as a declared allergen
 * is a direct {@link AlertKind#ALLERGY}; anything reached through a
 * cross-reactivity group, including an allergen named by class, is a
 * {@link AlertKind#CROSS_ALLERGY} at the group's severity.
 * <p>
 * A class allergen that no group lists ("statin", "ACE inhibitor") still
 * catches drugs of that class as an {@link AlertKind#ALLERGY}, and is reported
 * once as a coverage gap because related classes cannot be checked.
 */
public final class CrossAllergyEvaluator implements RuleEvaluator {

	private final ReferenceDataStore store;

	public CrossAllergyEvaluator(ReferenceDataStore store) {
		this.store = store;
	}

	@Override
	public String name() {
		return "cross_allergy";
	}

	@Override
	public List<RawFinding> evaluate(EvaluationContext ctx) {
		List<RawFinding> out = new ArrayList<>();
		List<NormalizedDrug> allergens = ctx.getRecognizedAllergens();
		List<NormalizedDrug> fresh = ctx.getRecognizedNewDrugs();
		if (allergens.isEmpty() || fresh.isEmpty()) {
			return out;
		}

		for (NormalizedDrug drug : fresh) {
			// allergen id -> raw text as the patient declared it
			Map<String, String> indirect = new LinkedHashMap<>();
			for (NormalizedDrug allergen : allergens) {
				if (allergen.isDrug() && allergen.getCanonicalId().equals(drug.getCanonicalId())) {
					out.add(directAllergy(drug, allergen));
				} else {
					indirect.putIfAbsent(allergen.getCanonicalId(), allergen.getRawName());
				}
			}
			indirect.remove(drug.getCanonicalId());
			if (indirect.isEmpty()) {
				continue;
			}
			Set<String> matched = new HashSet<>();
			for (CrossAllergyMatch m : store.lookupCrossAllergy(drug.getCanonicalId(), indirect.keySet())) {
				out.add(crossAllergy(drug, m, indirect.get(m.getAllergenId())));
				matched.add(m.getAllergenId());
			}
			for (NormalizedDrug allergen : allergens) {
				if (allergen.getSubjectType() == SubjectType.CLASS && !matched.contains(allergen.getCanonicalId())
						&& drug.getClassTags().contains(allergen.getCanonicalId())) {
					out.add(classAllergy(drug, allergen));
				}
			}
		}

		Set<String> reported = new LinkedHashSet<>();
		for (NormalizedDrug allergen : allergens) {
			String tag = allergen.getCanonicalId();
			if (allergen.getSubjectType() == SubjectType.CLASS && !store.isCrossAllergyMember(tag)
					&& reported.add(tag)) {
				out.add(uncoveredClass(allergen));
			}
		}
		return out;
	}

	private static RawFinding directAllergy(NormalizedDrug drug, NormalizedDrug allergen) {
		String allergenText = allergen.getRawName() == null ? drug.getDisplayName() : allergen.getRawName().trim();
		AlertDetails details = AlertDetails.builder().allergen(allergenText).drugs(List.of(drug.getDisplayName()))
				.evidence(EvidenceLevel.HIGH).build();
		return RawFinding.builder().key(AlertKey.of(AlertKind.ALLERGY, drug.getCanonicalId()))
				.severity(Severity.CRITICAL).evidence(EvidenceLevel.HIGH).title("Allergy: " + drug.getDisplayName())
				.message("Patient has a declared allergy to " + allergenText + ". Do not prescribe.").details(details)
				.ruleId("").build();
	}

	private static RawFinding classAllergy(NormalizedDrug drug, NormalizedDrug allergen) {
		String allergenText = allergen.getRawName() == null ? allergen.getCanonicalId() : allergen.getRawName().trim();
		String label = allergen.getCanonicalId().replace('_', ' ');
		AlertDetails details = AlertDetails.builder().allergen(allergenText).drugs(List.of(drug.getDisplayName()))
				.evidence(EvidenceLevel.HIGH).build();
		return RawFinding.builder().key(AlertKey.of(AlertKind.ALLERGY, drug.getCanonicalId()))
				.severity(Severity.CRITICAL).evidence(EvidenceLevel.HIGH).title("Allergy: " + drug.getDisplayName())
				.message(drug.getDisplayName() + " is a " + label + "; patient has a declared allergy to " + allergenText
						+ ". Do not prescribe.")
				.details(details).ruleId("").build();
	}

	private static RawFinding uncoveredClass(NormalizedDrug allergen) {
		String tag = allergen.getCanonicalId();
		String allergenText = allergen.getRawName() == null ? tag : allergen.getRawName().trim();
		return RawFinding.builder().key(AlertKey.of(AlertKind.UNRECOGNIZED, "allergy_class:" + tag))
				.severity(Severity.MINOR).title("No cross-reactivity data: " + allergenText)
				.message("Only drugs in the " + tag.replace('_', ' ') + " class are checked against the declared allergy '"
						+ allergenText + "'. Review related classes manually.")
				.details(AlertDetails.builder().allergen(allergenText).build()).ruleId("").build();
	}

	private static RawFinding crossAllergy(NormalizedDrug drug, CrossAllergyMatch m, String allergenRaw) {
		CrossAllergyGroup g = m.getGroup();
		String allergenText = allergenRaw == null ? m.getAllergenId() : allergenRaw.trim();
		StringBuilder msg = new StringBuilder();
		msg.append(drug.getDisplayName()).append(" belongs to the ").append(g.getName())
				.append(" cross-reactivity group with declared allergy '").append(allergenText).append("'.");
		if (!g.getNote().isEmpty()) {
			msg.append(' ').append(g.getNote());
		}

		AlertDetails details = AlertDetails.builder().allergen(allergenText).groupId(g.getGroupId())
				.groupName(g.getName()).drugs(List.of(drug.getDisplayName())).build();
		return RawFinding.builder().key(AlertKey.forGroup(AlertKind.CROSS_ALLERGY, drug.getCanonicalId(), g.getGroupId()))
				.severity(g.getSeverity()).title("Cross-allergy: " + drug.getDisplayName() + " (" + g.getName() + ")")
				.message(msg.toString()).details(details).ruleId("").build();
	}
}
