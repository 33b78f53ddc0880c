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

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Structured detail carried by an alert so the UI can render it without a
 * further lookup. Fields that do not apply to an alert kind are empty.
 */
@Value
@Builder(toBuilder = true)
public class AlertDetails {

	@Builder.Default
	String mechanism = "";

	@Builder.Default
	String clinicalEffect = "";

	@Builder.Default
	String management = "";

	EvidenceLevel evidence;

	/** Alternative drug identifiers (contraindications). */
	@Builder.Default
	List<String> alternatives = List.of();

	/** Display names of the drugs involved, in input order. */
	@Builder.Default
	List<String> drugs = List.of();

	/** Condition identifier (contraindication and qualified kinds). */
	@Builder.Default
	String condition = "";

	/** The allergy string that triggered an allergy/cross-allergy alert. */
	@Builder.Default
	String allergen = "";

	@Builder.Default
	String groupId = "";

	@Builder.Default
	String groupName = "";

	/** Reference rule ids that matched, sorted. */
	@Builder.Default
	List<String> ruleIds = List.of();

	public static AlertDetails empty() {
		return AlertDetails.builder().build();
	}
}
