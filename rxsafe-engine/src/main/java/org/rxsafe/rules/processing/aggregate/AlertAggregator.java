package org.rxsafe.rules.processing.aggregate;

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

import java.util.*;

import org.apache.commons.lang3.StringUtils;
import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.AlertDetails;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.RawFinding;
import org.rxsafe.rules.om.Severity;

/**
 * Merges raw findings into the ordered alert list shown to the clinician.
 * <p>
 * Findings with the same {@link AlertKey} collapse into one alert. The
 * representative finding is the most severe, then the best evidenced, then
 * the lowest rule id. Other findings with the same mechanism text contribute
 * their management guidance; every contributing rule id and alternative is
 * kept.
 * <p>
 * Output order: severity (critical first), kind priority, then subject. The
 * aggregator holds no state; the same findings always give the same list.
 */
public final class AlertAggregator {

	static final Comparator<RawFinding> REPRESENTATIVE = Comparator
			.comparing(RawFinding::getSeverity)
			.thenComparing(RawFinding::evidenceOrDefault)
			.thenComparing(f -> StringUtils.defaultString(f.getRuleId()))
			.thenComparing(f -> StringUtils.defaultString(f.getTitle()));

	public static final Comparator<Alert> ORDER = Comparator
			.comparing(Alert::getSeverity)
			.thenComparing(Alert::getKey);

	public List<Alert> aggregate(Collection<RawFinding> findings) {
		Map<AlertKey, List<RawFinding>> byKey = new LinkedHashMap<>();
		for (RawFinding f : findings) {
			byKey.computeIfAbsent(f.getKey(), k -> new ArrayList<>()).add(f);
		}
		List<Alert> out = new ArrayList<>(byKey.size());
		for (List<RawFinding> group : byKey.values()) {
			out.add(merge(group));
		}
		out.sort(ORDER);
		return out;
	}

	private static Alert merge(List<RawFinding> group) {
		List<RawFinding> sorted = new ArrayList<>(group);
		sorted.sort(REPRESENTATIVE);
		RawFinding rep = sorted.get(0);
		AlertDetails repDetails = rep.getDetails() == null ? AlertDetails.empty() : rep.getDetails();

		Set<String> management = new LinkedHashSet<>();
		addIfPresent(management, repDetails.getManagement());
		Set<String> ruleIds = new TreeSet<>();
		Set<String> alternatives = new LinkedHashSet<>();
		boolean absolute = false;

		for (RawFinding f : sorted) {
			AlertDetails d = f.getDetails() == null ? AlertDetails.empty() : f.getDetails();
			if (f != rep && sameMechanism(repDetails, d)) {
				addIfPresent(management, d.getManagement());
			}
			addIfPresent(ruleIds, f.getRuleId());
			for (String id : d.getRuleIds()) {
				addIfPresent(ruleIds, id);
			}
			alternatives.addAll(d.getAlternatives());
			absolute |= f.isAbsolute();
		}

		AlertDetails merged = repDetails.toBuilder().management(String.join(" ", management))
				.alternatives(List.copyOf(alternatives)).ruleIds(List.copyOf(ruleIds)).build();

		boolean informational = rep.getKind() == AlertKind.UNRECOGNIZED;
		boolean requiresReason = !informational
				&& (rep.getSeverity() == Severity.CRITICAL || isContraindication(rep.getKind()));

		return Alert.builder().key(rep.getKey()).severity(rep.getSeverity()).title(rep.getTitle())
				.message(rep.getMessage()).details(merged).canOverride(informational || !absolute)
				.overrideRequiresReason(requiresReason).build();
	}

	/** Qualified renal, pregnancy and geriatric alerts are contraindication rules too. */
	static boolean isContraindication(AlertKind kind) {
		switch (kind) {
		case CONTRAINDICATION:
		case RENAL:
		case PREGNANCY:
		case GERIATRIC:
			return true;
		default:
			return false;
		}
	}

	private static boolean sameMechanism(AlertDetails a, AlertDetails b) {
		return StringUtils.equalsIgnoreCase(StringUtils.normalizeSpace(a.getMechanism()),
				StringUtils.normalizeSpace(b.getMechanism()));
	}

	private static void addIfPresent(Set<String> set, String value) {
		if (StringUtils.isNotBlank(value)) {
			set.add(value.trim());
		}
	}
}
