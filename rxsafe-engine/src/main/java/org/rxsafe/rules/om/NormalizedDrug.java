package org.rxsafe.rules.om;

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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of resolving a free-text name. An unrecognized name is still a value
 * ({@link SubjectType#UNRECOGNIZED}) and travels through evaluation so the
 * coverage gap can be reported.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizedDrug {

	String rawName;
	SubjectType subjectType;

	/** Drug id, class tag or group id; null when unrecognized. */
	String canonicalId;

	String displayName;
	Set<String> classTags;

	public static NormalizedDrug ofDrug(String rawName, DrugReference drug) {
		return new NormalizedDrug(rawName, SubjectType.DRUG, drug.getId(), drug.getDisplayName(), drug.getClassTags());
	}

	public static NormalizedDrug ofClass(String rawName, String classTag) {
		return new NormalizedDrug(rawName, SubjectType.CLASS, classTag, classTag, Collections.emptySet());
	}

	public static NormalizedDrug ofGroup(String rawName, CrossAllergyGroup group) {
		return new NormalizedDrug(rawName, SubjectType.ALLERGY_GROUP, group.getGroupId(), group.getName(),
				Collections.emptySet());
	}

	public static NormalizedDrug unrecognized(String rawName) {
		String shown = rawName == null ? "" : rawName.trim();
		return new NormalizedDrug(rawName, SubjectType.UNRECOGNIZED, null, shown, Collections.emptySet());
	}

	public boolean isRecognized() {
		return subjectType != SubjectType.UNRECOGNIZED;
	}

	public boolean isDrug() {
		return subjectType == SubjectType.DRUG;
	}

	/**
	 * Identifiers used for rule matching: the canonical id followed by the class
	 * tags (one-hop expansion). Empty when unrecognized.
	 */
	public Set<String> getMatchIdentifiers() {
		if (!isRecognized()) {
			return Collections.emptySet();
		}
		Set<String> ids = new LinkedHashSet<>();
		ids.add(canonicalId);
		ids.addAll(classTags);
		return ids;
	}
}
