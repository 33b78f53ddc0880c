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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.om.Severity;

/**
 * Two or more drugs from the same duplicate-risk class, or the same drug
 * prescribed again while the patient is already taking it.
 * <p>
 * Severity is fixed at {@link Severity#MODERATE} however many drugs share the
 * class. At least one drug of the group must be new; a class shared only by
 * current drugs is not re-flagged.
 */
public final class DuplicateTherapyEvaluator implements RuleEvaluator {

	public static final Severity SEVERITY = Severity.MODERATE;

	private final Set<String> duplicateClasses;

	public DuplicateTherapyEvaluator(Set<String> duplicateClasses) {
		this.duplicateClasses = Set.copyOf(duplicateClasses);
	}

	@Override
	public String name() {
		return "duplicate_therapy";
	}

	@Override
	public List<RawFinding> evaluate(EvaluationContext ctx) {
		List<RawFinding> out = new ArrayList<>();
		List<NormalizedDrug> fresh = ctx.getRecognizedNewDrugs();
		List<NormalizedDrug> current = ctx.getRecognizedCurrentDrugs();

		// Same drug twice
		Map<String, NormalizedDrug> seen = new LinkedHashMap<>();
		for (NormalizedDrug c : current) {
			seen.putIfAbsent(c.getCanonicalId(), c);
		}
		Set<String> reported = new LinkedHashSet<>();
		for (NormalizedDrug n : fresh) {
			NormalizedDrug earlier = seen.putIfAbsent(n.getCanonicalId(), n);
			if (earlier != null && reported.add(n.getCanonicalId())) {
				out.add(sameDrug(n, earlier));
			}
		}

		// Same class: input order, new drugs first
		Map<String, Map<String, NormalizedDrug>> byClass = new LinkedHashMap<>();
		Set<String> newIds = new LinkedHashSet<>();
		for (NormalizedDrug n : fresh) {
			newIds.add(n.getCanonicalId());
			collect(n, byClass);
		}
		for (NormalizedDrug c : current) {
			collect(c, byClass);
		}
		for (Map.Entry<String, Map<String, NormalizedDrug>> e : byClass.entrySet()) {
			Map<String, NormalizedDrug> members = e.getValue();
			if (members.size() < 2) {
				continue;
			}
			boolean anyNew = members.keySet().stream().anyMatch(newIds::contains);
			if (anyNew) {
				out.add(sameClass(e.getKey(), new ArrayList<>(members.values())));
			}
		}
		return out;
	}

	private void collect(NormalizedDrug d, Map<String, Map<String, NormalizedDrug>> byClass) {
		for (String tag : d.getClassTags()) {
			if (duplicateClasses.contains(tag)) {
				byClass.computeIfAbsent(tag, k -> new LinkedHashMap<>()).putIfAbsent(d.getCanonicalId(), d);
			}
		}
	}

	private static RawFinding sameClass(String classTag, List<NormalizedDrug> drugs) {
		List<String> names = new ArrayList<>();
		for (NormalizedDrug d : drugs) {
			names.add(d.getDisplayName());
		}
		String label = classTag.replace('_', ' ');
		AlertDetails details = AlertDetails.builder().drugs(names)
				.management("Confirm that more than one " + label + " is intended; otherwise stop one.").build();
		return RawFinding.builder().key(AlertKey.of(AlertKind.DUPLICATE_THERAPY, classTag)).severity(SEVERITY)
				.title("Duplicate therapy: " + label)
				.message(String.join(", ", names) + " share the " + label + " class.").details(details)
				.ruleId("").build();
	}

	private static RawFinding sameDrug(NormalizedDrug fresh, NormalizedDrug earlier) {
		List<String> names = List.of(fresh.getDisplayName());
		AlertDetails details = AlertDetails.builder().drugs(names)
				.management("Check whether this replaces the existing prescription.").build();
		String earlierText = earlier.getRawName() == null ? earlier.getDisplayName() : earlier.getRawName().trim();
		return RawFinding.builder().key(AlertKey.of(AlertKind.DUPLICATE_THERAPY, fresh.getCanonicalId()))
				.severity(SEVERITY).title("Duplicate therapy: " + fresh.getDisplayName())
				.message(fresh.getDisplayName() + " is already prescribed (" + earlierText + ").").details(details)
				.ruleId("").build();
	}
}
