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

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.rxsafe.rules.om.Gender;
import org.rxsafe.rules.om.NormalizedDrug;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Normalized inputs of a single check, shared read-only by all evaluators.
 */
@Value
@Builder
public class EvaluationContext {

	@Singular("newDrug")
	List<NormalizedDrug> newDrugs;

	@Singular("currentDrug")
	List<NormalizedDrug> currentDrugs;

	/** Normalized condition ids. */
	@Singular("condition")
	Set<String> conditions;

	@Singular("allergen")
	List<NormalizedDrug> allergens;

	int age;

	@Builder.Default
	Gender gender = Gender.UNKNOWN;

	/** Estimated GFR in mL/min/1.73m2; null when not measured. */
	Double egfr;

	boolean pregnant;

	public List<NormalizedDrug> getRecognizedNewDrugs() {
		return newDrugs.stream().filter(NormalizedDrug::isDrug).collect(Collectors.toList());
	}

	public List<NormalizedDrug> getRecognizedCurrentDrugs() {
		return currentDrugs.stream().filter(NormalizedDrug::isDrug).collect(Collectors.toList());
	}

	public List<NormalizedDrug> getRecognizedAllergens() {
		return allergens.stream().filter(NormalizedDrug::isRecognized).collect(Collectors.toList());
	}
}
