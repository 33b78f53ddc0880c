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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Named set of drugs and classes that cross-react (e.g. beta-lactams).
 * Members are drug identifiers or class tags; matching goes one hop through a
 * drug's class tags.
 */
@Value
public class CrossAllergyGroup {

	String groupId;
	String name;
	Set<String> members;
	Severity severity;
	String note;

	/** Free-text allergy strings that mean the whole group, e.g. "sulfa". */
	Set<String> allergenAliases;

	@Builder
	public CrossAllergyGroup(String groupId, String name, Collection<String> members, Severity severity, String note,
			Collection<String> allergenAliases) {
		this.groupId = groupId;
		this.name = (name == null || name.isBlank()) ? groupId : name;
		this.members = DrugReference.frozen(members);
		this.severity = severity == null ? Severity.MAJOR : severity;
		this.note = note == null ? "" : note;
		this.allergenAliases = allergenAliases == null ? Collections.emptySet() : DrugReference.frozen(allergenAliases);
	}

	/** True if any of the identifiers is a declared member. */
	public boolean containsAny(Collection<String> identifiers) {
		for (String id : identifiers) {
			if (members.contains(id)) {
				return true;
			}
		}
		return false;
	}
}
