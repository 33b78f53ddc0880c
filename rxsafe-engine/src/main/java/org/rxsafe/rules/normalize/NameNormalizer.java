package org.rxsafe.rules.normalize;

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
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.rxsafe.rules.om.CrossAllergyGroup;
import org.rxsafe.rules.om.DrugReference;
import org.rxsafe.rules.om.NormalizedDrug;
import org.rxsafe.rules.reference.ReferenceDataStore;
import org.rxsafe.rules.util.DoseText;
import org.rxsafe.rules.util.Logger;

/**
 * Resolves free-text drug and allergen names to canonical identifiers.
 * <p>
 * Resolution is exact on the normalized key first, then on the key with
 * strength, regimen and dosage-form text removed, then with trailing salt
 * words removed. A name that still does not match is returned as
 * {@link NormalizedDrug#unrecognized(String)}; it never becomes a guess.
 * Stateless apart from the shared store, so safe for concurrent use.
 */
public final class NameNormalizer {

	private final ReferenceDataStore store;

	public NameNormalizer(ReferenceDataStore store) {
		this.store = store;
	}

	/**
	 * Normalize a medicine name as entered on a prescription or medication list.
	 */
	public NormalizedDrug normalize(String raw) {
		Optional<DrugReference> drug = resolveDrug(raw);
		if (drug.isPresent()) {
			return NormalizedDrug.ofDrug(raw, drug.get());
		}
		Logger.debug("Unrecognized drug name '{}'", raw);
		return NormalizedDrug.unrecognized(raw);
	}

	public List<NormalizedDrug> normalizeAll(Collection<String> raws) {
		List<NormalizedDrug> out = new ArrayList<>(raws.size());
		for (String raw : raws) {
			out.add(normalize(raw));
		}
		return out;
	}

	/**
	 * Normalize a declared allergy. Tried in order: a drug name, a drug class
	 * tag, then a cross-allergy group by id, name or allergen alias.
	 */
	public NormalizedDrug normalizeAllergen(String raw) {
		Optional<DrugReference> drug = resolveDrug(raw);
		if (drug.isPresent()) {
			return NormalizedDrug.ofDrug(raw, drug.get());
		}
		String id = ReferenceDataStore.normalizeIdentifier(raw);
		if (store.isClassTag(id)) {
			return NormalizedDrug.ofClass(raw, id);
		}
		Optional<CrossAllergyGroup> group = store.findGroupByAlias(DoseText.normalizeKey(raw));
		if (group.isPresent()) {
			return NormalizedDrug.ofGroup(raw, group.get());
		}
		Logger.debug("Unrecognized allergen '{}'", raw);
		return NormalizedDrug.unrecognized(raw);
	}

	public List<NormalizedDrug> normalizeAllergens(Collection<String> raws) {
		List<NormalizedDrug> out = new ArrayList<>(raws.size());
		for (String raw : raws) {
			out.add(normalizeAllergen(raw));
		}
		return out;
	}

	private Optional<DrugReference> resolveDrug(String raw) {
		String key = DoseText.normalizeKey(raw);
		if (key.isEmpty()) {
			return Optional.empty();
		}
		Optional<DrugReference> hit = store.findDrugByAlias(key);
		if (hit.isPresent()) {
			return hit;
		}
		String stripped = DoseText.removeRegimen(key);
		if (!stripped.isEmpty() && !stripped.equals(key)) {
			hit = store.findDrugByAlias(stripped);
			if (hit.isPresent()) {
				return hit;
			}
		} else {
			stripped = key;
		}
		String saltFree = DoseText.removeSalt(stripped);
		if (!saltFree.equals(stripped)) {
			return store.findDrugByAlias(saltFree);
		}
		return Optional.empty();
	}
}
