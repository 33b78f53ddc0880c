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

import java.util.*;

import org.rxsafe.rules.om.ContraindicationRule;
import org.rxsafe.rules.om.CrossAllergyGroup;
import org.rxsafe.rules.om.DrugReference;
import org.rxsafe.rules.om.InteractionRule;
import org.rxsafe.rules.om.PairKey;
import org.rxsafe.rules.util.DoseText;

/**
 * Immutable, indexed view of the reference data. Built once by
 * {@link ReferenceDataLoader} and shared by every evaluator thread without
 * locking.
 * <p>
 * Identifiers (drug ids, class tags, condition ids, group ids) are lower-case
 * with underscores. A drug id expands to itself plus its class tags for every
 * lookup, so a rule written against {@code nsaid} fires for ibuprofen.
 */
public final class ReferenceDataStore {

	private final Map<String, DrugReference> drugsById;
	private final Map<String, String> drugAliasIndex;
	private final Set<String> classTags;
	private final Map<PairKey, List<InteractionRule>> interactionsByPair;
	private final Map<String, List<ContraindicationRule>> contraindicationsBySubject;
	private final Set<String> knownConditions;
	private final Map<String, CrossAllergyGroup> groupsById;
	private final Map<String, String> groupAliasIndex;
	private final Set<String> groupMembers;
	private final int interactionRuleCount;
	private final int contraindicationRuleCount;

	ReferenceDataStore(Map<String, DrugReference> drugsById, Map<String, String> drugAliasIndex,
			Map<PairKey, List<InteractionRule>> interactionsByPair,
			Map<String, List<ContraindicationRule>> contraindicationsBySubject, Map<String, CrossAllergyGroup> groupsById,
			Map<String, String> groupAliasIndex) {
		this.drugsById = Collections.unmodifiableMap(new TreeMap<>(drugsById));
		this.drugAliasIndex = Map.copyOf(drugAliasIndex);

		Set<String> tags = new TreeSet<>();
		for (DrugReference d : drugsById.values()) {
			tags.addAll(d.getClassTags());
		}
		this.classTags = Collections.unmodifiableSet(tags);

		Map<PairKey, List<InteractionRule>> ddi = new HashMap<>();
		Set<String> ruleIds = new HashSet<>();
		interactionsByPair.forEach((k, v) -> {
			ddi.put(k, List.copyOf(v));
			v.forEach(r -> ruleIds.add(r.getRuleId()));
		});
		this.interactionsByPair = Collections.unmodifiableMap(ddi);
		this.interactionRuleCount = ruleIds.size();

		Map<String, List<ContraindicationRule>> ci = new HashMap<>();
		Set<String> conditions = new TreeSet<>();
		int ciCount = 0;
		for (Map.Entry<String, List<ContraindicationRule>> e : contraindicationsBySubject.entrySet()) {
			ci.put(e.getKey(), List.copyOf(e.getValue()));
			for (ContraindicationRule r : e.getValue()) {
				conditions.add(r.getCondition());
				ciCount++;
			}
		}
		this.contraindicationsBySubject = Collections.unmodifiableMap(ci);
		this.knownConditions = Collections.unmodifiableSet(conditions);
		this.contraindicationRuleCount = ciCount;

		this.groupsById = Collections.unmodifiableMap(new TreeMap<>(groupsById));
		this.groupAliasIndex = Map.copyOf(groupAliasIndex);

		Set<String> members = new TreeSet<>();
		for (CrossAllergyGroup g : groupsById.values()) {
			members.addAll(g.getMembers());
		}
		this.groupMembers = Collections.unmodifiableSet(members);
	}

	// ------------------------------------------------------------------
	// Identifier helpers
	// ------------------------------------------------------------------

	/**
	 * Canonical identifier form: lower-case, trimmed, whitespace and hyphens
	 * replaced by underscores. "CKD Stage-4" becomes "ckd_stage_4".
	 */
	public static String normalizeIdentifier(String raw) {
		return DoseText.toIdentifier(raw);
	}

	/** Condition ids share the identifier form. */
	public static String normalizeCondition(String raw) {
		return normalizeIdentifier(raw);
	}

	/** The identifier plus, for a known drug, its class tags. */
	public Set<String> expand(String id) {
		Set<String> out = new LinkedHashSet<>();
		if (id == null) {
			return out;
		}
		out.add(id);
		DrugReference d = drugsById.get(id);
		if (d != null) {
			out.addAll(d.getClassTags());
		}
		return out;
	}

	// ------------------------------------------------------------------
	// Drugs and classes
	// ------------------------------------------------------------------

	public Optional<DrugReference> getDrug(String id) {
		return Optional.ofNullable(drugsById.get(id));
	}

	/** Drug whose id, display name or alias has this normalized key. */
	public Optional<DrugReference> findDrugByAlias(String key) {
		String id = drugAliasIndex.get(DoseText.normalizeKey(key));
		return id == null ? Optional.empty() : Optional.of(drugsById.get(id));
	}

	public boolean isDrug(String id) {
		return drugsById.containsKey(id);
	}

	public boolean isClassTag(String tag) {
		return classTags.contains(tag);
	}

	public Collection<DrugReference> getDrugs() {
		return drugsById.values();
	}

	public Set<String> getClassTags() {
		return classTags;
	}

	/** Drugs carrying the class tag, in id order. */
	public List<DrugReference> drugsInClass(String tag) {
		List<DrugReference> out = new ArrayList<>();
		for (DrugReference d : drugsById.values()) {
			if (d.hasClassTag(tag)) {
				out.add(d);
			}
		}
		return out;
	}

	// ------------------------------------------------------------------
	// Interactions
	// ------------------------------------------------------------------

	/**
	 * All interaction rules between two identifiers, searched across the cross
	 * product of their expansions. Symmetric in its arguments; sorted by rule id.
	 */
	public List<InteractionRule> lookupInteractions(String idA, String idB) {
		Map<String, InteractionRule> hits = new TreeMap<>();
		for (String a : expand(idA)) {
			for (String b : expand(idB)) {
				List<InteractionRule> rules = interactionsByPair.get(PairKey.of(a, b));
				if (rules != null) {
					for (InteractionRule r : rules) {
						hits.putIfAbsent(r.getRuleId(), r);
					}
				}
			}
		}
		return new ArrayList<>(hits.values());
	}

	public int getInteractionRuleCount() {
		return interactionRuleCount;
	}

	// ------------------------------------------------------------------
	// Contraindications
	// ------------------------------------------------------------------

	/**
	 * Rules for the drug (or any of its classes) whose condition is among the
	 * given normalized condition ids. Sorted by rule id.
	 */
	public List<ContraindicationRule> lookupContraindications(String drugId, Set<String> conditionIds) {
		List<ContraindicationRule> out = new ArrayList<>();
		for (ContraindicationRule r : contraindicationsFor(drugId)) {
			if (conditionIds.contains(r.getCondition())) {
				out.add(r);
			}
		}
		return out;
	}

	/** Every rule whose subject is the drug or one of its classes. Sorted by rule id. */
	public List<ContraindicationRule> contraindicationsFor(String drugId) {
		List<ContraindicationRule> out = new ArrayList<>();
		for (String s : expand(drugId)) {
			List<ContraindicationRule> rules = contraindicationsBySubject.get(s);
			if (rules != null) {
				out.addAll(rules);
			}
		}
		out.sort(Comparator.comparing(ContraindicationRule::getRuleId));
		return out;
	}

	/** True when at least one contraindication rule names the condition. */
	public boolean isKnownCondition(String conditionId) {
		return knownConditions.contains(conditionId);
	}

	public Set<String> getKnownConditions() {
		return knownConditions;
	}

	public int getContraindicationRuleCount() {
		return contraindicationRuleCount;
	}

	// ------------------------------------------------------------------
	// Cross-allergy
	// ------------------------------------------------------------------

	public Optional<CrossAllergyGroup> getGroup(String groupId) {
		return Optional.ofNullable(groupsById.get(groupId));
	}

	/** Group whose id, name or allergen alias has this normalized key. */
	public Optional<CrossAllergyGroup> findGroupByAlias(String key) {
		String id = groupAliasIndex.get(DoseText.normalizeKey(key));
		return id == null ? Optional.empty() : Optional.of(groupsById.get(id));
	}

	public Collection<CrossAllergyGroup> getGroups() {
		return groupsById.values();
	}

	/** True if some cross-reactivity group lists this drug id or class tag. */
	public boolean isCrossAllergyMember(String id) {
		return groupMembers.contains(id);
	}

	/**
	 * Groups in which the drug and a declared allergen are both members. An
	 * allergen that is itself a group id is matched only against that group
	 * and stands for all of its members. One hop only: membership is never
	 * chained through a second group. Results are ordered by allergen, then
	 * group id.
	 */
	public List<CrossAllergyMatch> lookupCrossAllergy(String drugId, Collection<String> allergenIds) {
		List<CrossAllergyMatch> out = new ArrayList<>();
		Set<String> drugIds = expand(drugId);
		for (String allergen : new TreeSet<>(allergenIds)) {
			CrossAllergyGroup asGroup = groupsById.get(allergen);
			if (asGroup != null) {
				String drugMember = firstMember(asGroup, drugIds);
				if (drugMember != null) {
					out.add(new CrossAllergyMatch(asGroup, allergen, drugMember, allergen));
				}
				continue;
			}
			Set<String> allergenExp = expand(allergen);
			for (CrossAllergyGroup g : groupsById.values()) {
				String drugMember = firstMember(g, drugIds);
				String allergenMember = firstMember(g, allergenExp);
				if (drugMember != null && allergenMember != null) {
					out.add(new CrossAllergyMatch(g, allergen, drugMember, allergenMember));
				}
			}
		}
		return out;
	}

	private static String firstMember(CrossAllergyGroup g, Set<String> ids) {
		for (String id : ids) {
			if (g.getMembers().contains(id)) {
				return id;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return "ReferenceDataStore[drugs=" + drugsById.size() + ", classes=" + classTags.size() + ", interactions="
				+ interactionRuleCount + ", contraindications=" + contraindicationRuleCount + ", allergyGroups="
				+ groupsById.size() + "]";
	}
}
