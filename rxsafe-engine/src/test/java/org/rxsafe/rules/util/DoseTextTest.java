package org.rxsafe.rules.util;

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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class DoseTextTest {

	@Test
	void normalizeKey_lowercases_trims_and_collapses() {
		assertEquals("metformin hcl", DoseText.normalizeKey("  Metformin \t  HCl "));
		assertEquals("", DoseText.normalizeKey(null));
	}

	@Test
	void toIdentifier_joins_words_with_underscores() {
		assertEquals("ckd_stage_4", DoseText.toIdentifier(" CKD Stage-4 "));
		assertEquals("ace_inhibitor", DoseText.toIdentifier("ACE  inhibitor"));
		assertEquals("nsaid", DoseText.toIdentifier("nsaid"));
	}

	@Test
	void removeUnits_strips_simple_range_and_composite_strengths() {
		assertEquals("Ibuprofen", DoseText.removeUnits("Ibuprofen 400mg"));
		assertEquals("Paracetamol syrup", DoseText.removeUnits("Paracetamol 120 mg/5 mL syrup"));
		assertEquals("Prednisolone", DoseText.removeUnits("Prednisolone 10-20 mg"));
		assertEquals("Hydrocortisone cream", DoseText.removeUnits("Hydrocortisone 1% cream"));
	}

	@Test
	void removeRegimen_strips_frequency_route_and_form() {
		assertEquals("warfarin", DoseText.removeRegimen("Warfarin 5mg OD"));
		assertEquals("amoxicillin", DoseText.removeRegimen("Amoxicillin 500 mg cap TDS"));
		assertEquals("metformin", DoseText.removeRegimen("Metformin 500 mg tablet BD PO"));
		assertEquals("paracetamol", DoseText.removeRegimen("Paracetamol 1 tab PRN"));
		assertEquals("", DoseText.removeRegimen("   "));
	}

	@Test
	void removeSalt_drops_trailing_salt_words_only() {
		assertEquals("metformin", DoseText.removeSalt("Metformin HCl"));
		assertEquals("diclofenac", DoseText.removeSalt("diclofenac sodium"));
		assertEquals("amlodipine", DoseText.removeSalt("amlodipine besylate"));
		// leading salt word is part of the name
		assertEquals("sodium valproate", DoseText.removeSalt("Sodium Valproate"));
		// nothing left after stripping -> unchanged
		assertEquals("sodium", DoseText.removeSalt("sodium"));
	}
}
