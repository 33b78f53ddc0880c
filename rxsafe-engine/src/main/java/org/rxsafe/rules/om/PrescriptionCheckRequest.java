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
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Input of one prescription check. Drug and allergy names are free text;
 * conditions are identifiers such as {@code ckd_stage4}.
 */
@Value
@Builder
public class PrescriptionCheckRequest {

	@Singular("newDrug")
	List<String> newDrugs;

	@Singular("currentDrug")
	List<String> currentDrugs;

	@Singular("condition")
	Set<String> conditions;

	@Singular("allergy")
	Set<String> allergies;

	int age;

	@Builder.Default
	Gender gender = Gender.UNKNOWN;

	/** Estimated GFR in mL/min/1.73m2; null when not measured. */
	Double egfr;

	/** Null when unknown. */
	Boolean pregnant;

	public boolean isPregnant() {
		return Boolean.TRUE.equals(pregnant);
	}
}
