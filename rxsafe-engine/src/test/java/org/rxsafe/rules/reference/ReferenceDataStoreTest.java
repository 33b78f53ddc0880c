package org.rxsafe.rules.reference;

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.rxsafe.rules.ReferenceFixtures;
import org.rxsafe.rules.om.ContraindicationRule;
import org.rxsafe.rules.om.DrugReference;
import org.rxsafe.rules.om.InteractionRule;

class ReferenceDataStoreTest {

	private static ReferenceDataStore store;

	@BeforeAll
	static void load() {
		store = ReferenceFixtures.bundled();
	}

	private static List<String> ruleIds(List<InteractionRule> rules) {
		return rules.stream().map(InteractionRule::getRuleId).collect(Collectors.toList());
	}

	// --- interactions --------------------------------------------------------

	@Test
	void interaction_lookup_is_symmetric_for_every_drug_pair() {
		for (DrugReference a : store.getDrugs()) {
			for (DrugReference b : store.getDrugs()) {
				assertEquals(store.lookupInteractions(a.getId(), b.getId()),
						store.lookupInteractions(b.getId(), a.getId()), a.getId() + " / " + b.getId());
			}
		}
	}

	@Test
	void class_level_rule_matches_every_member_of_the_class() {
		List<DrugReference> nsaids = store.drugsInClass("nsaid");
		assertTrue(nsaids.size() >= 3);
		for (DrugReference nsaid : nsaids) {
			assertTrue(ruleIds(store.lookupInteractions("warfarin", nsaid.getId())).contains("DDI-001"),
					nsaid.getId());
		}
	}

	@Test
	void literal_and_class_rules_are_both_returned_sorted_by_rule_id() {
		assertEquals(List.of("DDI-006", "DDI-007"), ruleIds(store.lookupInteractions("clarithromycin", "simvastatin")));
		assertEquals(List.of("DDI-001", "DDI-002"), ruleIds(store.lookupInteractions("ibuprofen", "warfarin")));
	}

	@Test
	void unrelated_or_unknown_identifiers_find_nothing() {
		assertTrue(store.lookupInteractions("paracetamol", "amoxicillin").isEmpty());
		assertTrue(store.lookupInteractions("warfarin", "no_such_drug").isEmpty());
	}

	// --- contraindications ---------------------------------------------------

	@Test
	void contraindications_match_literal_id_and_class_tags() {
		List<String> ids = store.lookupContraindications("aspirin", Set.of("peptic_ulcer")).stream()
				.map(ContraindicationRule::getRuleId).collect(Collectors.toList());
		assertEquals(List.of("CI-004", "CI-031"), ids);
	}

	@Test
	void contraindications_ignore_conditions_not_in_the_set() {
		assertTrue(store.lookupContraindications("metformin", Set.of("asthma")).isEmpty());
		assertEquals(1, store.lookupContraindications("metformin", Set.of("ckd_stage4")).size());
	}

	@Test
	void known_conditions_come_from_contraindication_rules() {
		assertTrue(store.isKnownCondition("ckd_stage4"));
		assertTrue(store.isKnownCondition("pregnancy"));
		assertFalse(store.isKnownCondition("gout"));
	}

	@Test
	void condition_ids_are_normalized() {
		assertEquals("ckd_stage4", ReferenceDataStore.normalizeCondition("CKD Stage4"));
		assertEquals("ckd_stage4", ReferenceDataStore.normalizeCondition(" ckd-stage4 "));
		assertEquals("peptic_ulcer", ReferenceDataStore.normalizeCondition("Peptic   ulcer"));
	}

	// --- cross-allergy -------------------------------------------------------

	@Test
	void cross_allergy_resolves_through_class_tags() {
		List<CrossAllergyMatch> matches = store.lookupCrossAllergy("amoxicillin", Set.of("penicillin"));
		assertEquals(1, matches.size());
		assertEquals("beta_lactams", matches.get(0).getGroup().getGroupId());
		assertEquals("penicillin", matches.get(0).getDrugMemberId());
	}

	@Test
	void cross_allergy_allergen_drug_reaches_other_members() {
		List<CrossAllergyMatch> matches = store.lookupCrossAllergy("cephalexin", Set.of("amoxicillin"));
		assertEquals(1, matches.size());
		assertEquals("cephalosporin", matches.get(0).getDrugMemberId());
		assertEquals("penicillin", matches.get(0).getAllergenMemberId());
	}

	@Test
	void allergen_that_is_a_group_stands_for_its_members() {
		List<CrossAllergyMatch> matches = store.lookupCrossAllergy("meropenem", Set.of("beta_lactams"));
		assertEquals(1, matches.size());
		assertTrue(store.lookupCrossAllergy("paracetamol", Set.of("beta_lactams")).isEmpty());
	}

	@Test
	void cross_allergy_is_one_hop_only() {
		// furosemide and cotrimoxazole share the sulfonamide group
		assertEquals(1, store.lookupCrossAllergy("furosemide", Set.of("cotrimoxazole")).size());
		// amoxicillin is in no group with cotrimoxazole
		assertTrue(store.lookupCrossAllergy("amoxicillin", Set.of("cotrimoxazole")).isEmpty());
	}

	@Test
	void group_membership_is_known_per_identifier() {
		assertTrue(store.isCrossAllergyMember("penicillin"));
		assertTrue(store.isCrossAllergyMember("phenytoin"));
		assertFalse(store.isCrossAllergyMember("statin"));
		assertFalse(store.isCrossAllergyMember("ace_inhibitor"));
	}

	// --- immutability --------------------------------------------------------

	@Test
	void exposed_collections_are_unmodifiable() {
		assertThrows(UnsupportedOperationException.class, () -> store.getClassTags().add("x"));
		assertThrows(UnsupportedOperationException.class, () -> store.getKnownConditions().add("x"));
		assertThrows(UnsupportedOperationException.class,
				() -> store.getDrug("warfarin").orElseThrow().getAliases().add("x"));
	}
}
