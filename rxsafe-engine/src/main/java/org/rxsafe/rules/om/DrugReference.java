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
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * A drug known to the reference data: canonical identifier, display name,
 * lower-cased aliases (brand names, salts, spellings) and class tags.
 * Immutable after load.
 */
@Value
public class DrugReference {

	String id;
	String displayName;
	Set<String> aliases;
	Set<String> classTags;

	@Builder
	public DrugReference(String id, String displayName, Collection<String> aliases, Collection<String> classTags) {
		this.id = id;
		this.displayName = (displayName == null || displayName.isBlank()) ? id : displayName;
		this.aliases = frozen(aliases);
		this.classTags = frozen(classTags);
	}

	public boolean hasClassTag(String tag) {
		return classTags.contains(tag);
	}

	static Set<String> frozen(Collection<String> in) {
		return in == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(in));
	}
}
