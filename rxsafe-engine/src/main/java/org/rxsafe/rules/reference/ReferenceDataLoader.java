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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.*;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.rxsafe.rules.om.ContraindicationRule;
import org.rxsafe.rules.om.CrossAllergyGroup;
import org.rxsafe.rules.om.DrugReference;
import org.rxsafe.rules.om.EvidenceLevel;
import org.rxsafe.rules.om.InteractionRule;
import org.rxsafe.rules.om.PairKey;
import org.rxsafe.rules.om.RuleQualifier;
import org.rxsafe.rules.om.Severity;
import org.rxsafe.rules.util.DoseText;
import org.rxsafe.rules.util.Logger;

/**
 * Reads the four reference CSV files and builds a {@link ReferenceDataStore}.
 * <p>
 * Files are read in dependency order: drug classes first (they define the
 * identifiers), then cross-allergy groups, interactions and contraindications.
 * Every row problem is collected rather than failing on the first one, so a
 * curator sees the whole list in one run. If anything is wrong the load fails
 * with a {@link DataLoadException}; no partial store is ever returned.
 *
 * <h3>Format</h3>
 * <ul>
 * <li>Comma separated, first non-comment line is the header, header names are
 * case-insensitive.</li>
 * <li>Lines starting with {@code #} are comments.</li>
 * <li>List cells (aliases, class tags, members, alternatives) use {@code |}.</li>
 * </ul>
 */
public final class ReferenceDataLoader {

	public static final String[] DRUG_CLASSES_HEADER = { "DRUG_ID", "DISPLAY_NAME", "ALIASES", "CLASS_TAGS" };
	public static final String[] INTERACTIONS_HEADER = { "RULE_ID", "SUBJECT_A", "SUBJECT_B", "SEVERITY", "MECHANISM",
			"CLINICAL_EFFECT", "MANAGEMENT", "EVIDENCE", "ABSOLUTE" };
	public static final String[] CONTRAINDICATIONS_HEADER = { "RULE_ID", "SUBJECT", "CONDITION", "SEVERITY", "REASON",
			"ALTERNATIVES", "QUALIFIER", "THRESHOLD", "ABSOLUTE" };
	public static final String[] CROSS_ALLERGIES_HEADER = { "GROUP_ID", "GROUP_NAME", "MEMBERS", "SEVERITY", "NOTE",
			"ALLERGEN_ALIASES" };

	private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.withDelimiter(',').withHeader().withIgnoreHeaderCase()
			.withTrim().withCommentMarker('#').withIgnoreEmptyLines();

	private static final String LIST_SEPARATOR = "|";

	// Collected while reading
	private final List<String> issues = new ArrayList<>();
	private final Map<String, DrugReference> drugs = new LinkedHashMap<>();
	private final Map<String, String> drugAliases = new HashMap<>();
	private final Set<String> tags = new HashSet<>();
	private final Map<String, CrossAllergyGroup> groups = new LinkedHashMap<>();
	private final Map<String, String> groupAliases = new HashMap<>();
	private final Map<PairKey, List<InteractionRule>> interactions = new HashMap<>();
	private final Map<String, List<ContraindicationRule>> contraindications = new HashMap<>();
	private final Set<String> ruleIds = new HashSet<>();

	private ReferenceDataLoader() {
	}

	/**
	 * Load and validate the reference data.
	 *
	 * @throws DataLoadException listing every issue found, if any
	 */
	public static ReferenceDataStore load(ReferenceSources sources) throws DataLoadException {
		return new ReferenceDataLoader().run(sources);
	}

	private ReferenceDataStore run(ReferenceSources sources) throws DataLoadException {
		long start = System.currentTimeMillis();

		read(sources.getDrugClasses(), DRUG_CLASSES_HEADER, this::drugRow);
		if (drugs.isEmpty() && issues.isEmpty()) {
			issues.add(sources.getDrugClasses().getName() + ": no drugs defined");
		}
		for (DrugReference d : drugs.values()) {
			for (String tag : d.getClassTags()) {
				if (drugs.containsKey(tag)) {
					issues.add(sources.getDrugClasses().getName() + ": class tag '" + tag + "' of drug '" + d.getId()
							+ "' is also a drug id");
				}
			}
		}

		read(sources.getCrossAllergies(), CROSS_ALLERGIES_HEADER, this::groupRow);
		read(sources.getInteractions(), INTERACTIONS_HEADER, this::interactionRow);
		read(sources.getContraindications(), CONTRAINDICATIONS_HEADER, this::contraindicationRow);

		if (!issues.isEmpty()) {
			Logger.error("Reference data rejected with {} issue(s)", issues.size());
			for (String issue : issues) {
				Logger.error("  {}", issue);
			}
			throw new DataLoadException(issues);
		}

		ReferenceDataStore store = new ReferenceDataStore(drugs, drugAliases, interactions, contraindications, groups,
				groupAliases);
		Logger.info("Loaded {} in {} ms", store, System.currentTimeMillis() - start);
		return store;
	}

	// ------------------------------------------------------------------
	// File reading
	// ------------------------------------------------------------------

	@FunctionalInterface
	private interface RowHandler {
		void accept(CSVRecord row, String where);
	}

	private void read(ReferenceSources.Source source, String[] required, RowHandler handler) {
		String name = source.getName();
		try (Reader reader = source.open(); CSVParser csv = new CSVParser(reader, CSV_FORMAT)) {
			Set<String> present = new HashSet<>();
			for (String h : csv.getHeaderNames()) {
				present.add(h.trim().toUpperCase(Locale.ROOT));
			}
			List<String> missing = new ArrayList<>();
			for (String col : required) {
				if (!present.contains(col)) {
					missing.add(col);
				}
			}
			if (!missing.isEmpty()) {
				issues.add(name + ": missing column(s) " + missing);
				return;
			}

			int rows = 0;
			for (CSVRecord row : csv) {
				String where = name + " record " + row.getRecordNumber();
				if (Logger.isEnabled(Logger.Level.TRACE)) {
					Logger.trace("{}: {}", where, row.toList());
				}
				try {
					handler.accept(row, where);
				} catch (IllegalArgumentException ex) {
					issues.add(where + ": " + ex.getMessage());
				}
				rows++;
			}
			Logger.debug("Read {} rows from {}", rows, name);
		} catch (IOException | UncheckedIOException | IllegalStateException e) {
			issues.add("Cannot read " + name + ": " + e.getMessage());
		}
	}

	// ------------------------------------------------------------------
	// Row handlers
	// ------------------------------------------------------------------

	private void drugRow(CSVRecord row, String where) {
		String id = ReferenceDataStore.normalizeIdentifier(cell(row, "DRUG_ID"));
		if (id.isEmpty()) {
			issues.add(where + ": blank DRUG_ID");
			return;
		}
		if (drugs.containsKey(id)) {
			issues.add(where + ": duplicate drug id '" + id + "'");
			return;
		}
		String display = cell(row, "DISPLAY_NAME");
		Set<String> aliases = new LinkedHashSet<>();
		for (String a : split(cell(row, "ALIASES"))) {
			aliases.add(DoseText.normalizeKey(a));
		}
		Set<String> classTags = new LinkedHashSet<>();
		for (String t : split(cell(row, "CLASS_TAGS"))) {
			classTags.add(ReferenceDataStore.normalizeIdentifier(t));
		}
		DrugReference drug = DrugReference.builder().id(id).displayName(display).aliases(aliases).classTags(classTags)
				.build();
		drugs.put(id, drug);
		tags.addAll(classTags);

		// Lookup keys: id, id with spaces, display name, aliases
		Set<String> keys = new LinkedHashSet<>();
		keys.add(id);
		keys.add(id.replace('_', ' '));
		keys.add(DoseText.normalizeKey(drug.getDisplayName()));
		keys.addAll(aliases);
		for (String key : keys) {
			String owner = drugAliases.putIfAbsent(key, id);
			if (owner != null && !owner.equals(id)) {
				issues.add(where + ": alias '" + key + "' of '" + id + "' already belongs to '" + owner + "'");
			}
		}
	}

	private void groupRow(CSVRecord row, String where) {
		String id = ReferenceDataStore.normalizeIdentifier(cell(row, "GROUP_ID"));
		if (id.isEmpty()) {
			issues.add(where + ": blank GROUP_ID");
			return;
		}
		if (groups.containsKey(id)) {
			issues.add(where + ": duplicate group id '" + id + "'");
			return;
		}
		if (drugs.containsKey(id) || tags.contains(id)) {
			issues.add(where + ": group id '" + id + "' collides with a drug id or class tag");
		}

		Set<String> members = new LinkedHashSet<>();
		for (String m : split(cell(row, "MEMBERS"))) {
			String member = ReferenceDataStore.normalizeIdentifier(m);
			if (!isDefined(member)) {
				issues.add(where + ": undefined member '" + member + "' in group '" + id + "'");
			}
			members.add(member);
		}
		if (members.isEmpty()) {
			issues.add(where + ": group '" + id + "' has no members");
		}

		String severityRaw = cell(row, "SEVERITY");
		Severity severity = severityRaw.isEmpty() ? Severity.MAJOR : Severity.fromToken(severityRaw);

		Set<String> allergenAliases = new LinkedHashSet<>();
		for (String a : split(cell(row, "ALLERGEN_ALIASES"))) {
			allergenAliases.add(DoseText.normalizeKey(a));
		}
		CrossAllergyGroup group = CrossAllergyGroup.builder().groupId(id).name(cell(row, "GROUP_NAME"))
				.members(members).severity(severity).note(cell(row, "NOTE")).allergenAliases(allergenAliases).build();
		groups.put(id, group);

		Set<String> keys = new LinkedHashSet<>();
		keys.add(id);
		keys.add(id.replace('_', ' '));
		keys.add(DoseText.normalizeKey(group.getName()));
		keys.addAll(allergenAliases);
		for (String key : keys) {
			String owner = groupAliases.putIfAbsent(key, id);
			if (owner != null && !owner.equals(id)) {
				issues.add(where + ": allergen alias '" + key + "' of group '" + id + "' already belongs to '" + owner
						+ "'");
			}
		}
	}

	private void interactionRow(CSVRecord row, String where) {
		String ruleId = cell(row, "RULE_ID");
		if (!claimRuleId(ruleId, where)) {
			return;
		}
		String a = ReferenceDataStore.normalizeIdentifier(cell(row, "SUBJECT_A"));
		String b = ReferenceDataStore.normalizeIdentifier(cell(row, "SUBJECT_B"));
		boolean ok = requireDefined(a, "SUBJECT_A", where) & requireDefined(b, "SUBJECT_B", where);
		if (!ok) {
			return;
		}

		InteractionRule rule = InteractionRule.builder().ruleId(ruleId).subjectA(a).subjectB(b)
				.severity(Severity.fromToken(cell(row, "SEVERITY"))).mechanism(cell(row, "MECHANISM"))
				.clinicalEffect(cell(row, "CLINICAL_EFFECT")).management(cell(row, "MANAGEMENT"))
				.evidence(EvidenceLevel.fromToken(cell(row, "EVIDENCE"))).absolute(parseFlag(cell(row, "ABSOLUTE")))
				.build();

		List<InteractionRule> existing = interactions.computeIfAbsent(rule.getPair(), k -> new ArrayList<>());
		if (!a.equals(b)) {
			for (InteractionRule other : existing) {
				boolean reversed = other.getSubjectA().equals(b) && other.getSubjectB().equals(a);
				if (!reversed) {
					continue;
				}
				if (other.getSeverity() == rule.getSeverity()
						&& StringUtils.equalsIgnoreCase(other.getMechanism(), rule.getMechanism())) {
					Logger.warn("{}: rule {} repeats {} in reverse order; ignored", where, ruleId, other.getRuleId());
					return;
				}
				issues.add(where + ": rule " + ruleId + " (" + a + "," + b + ") conflicts with reversed rule "
						+ other.getRuleId() + " (" + other.getSubjectA() + "," + other.getSubjectB() + ")");
				return;
			}
		}
		existing.add(rule);
	}

	private void contraindicationRow(CSVRecord row, String where) {
		String ruleId = cell(row, "RULE_ID");
		if (!claimRuleId(ruleId, where)) {
			return;
		}
		String subject = ReferenceDataStore.normalizeIdentifier(cell(row, "SUBJECT"));
		if (!requireDefined(subject, "SUBJECT", where)) {
			return;
		}
		String condition = ReferenceDataStore.normalizeCondition(cell(row, "CONDITION"));
		if (condition.isEmpty()) {
			issues.add(where + ": blank CONDITION");
			return;
		}

		List<String> alternatives = new ArrayList<>();
		for (String alt : split(cell(row, "ALTERNATIVES"))) {
			String altId = ReferenceDataStore.normalizeIdentifier(alt);
			if (!drugs.containsKey(altId)) {
				issues.add(where + ": alternative '" + altId + "' is not a known drug");
			} else {
				alternatives.add(altId);
			}
		}

		RuleQualifier qualifier = RuleQualifier.fromToken(cell(row, "QUALIFIER"));
		Double threshold = null;
		String thresholdRaw = cell(row, "THRESHOLD");
		if (!thresholdRaw.isEmpty()) {
			try {
				threshold = Double.valueOf(thresholdRaw);
			} catch (NumberFormatException nfe) {
				issues.add(where + ": THRESHOLD is not a number: '" + thresholdRaw + "'");
				return;
			}
		}
		if (qualifier.requiresThreshold() && threshold == null) {
			issues.add(where + ": qualifier " + qualifier + " requires a THRESHOLD");
			return;
		}

		ContraindicationRule rule = ContraindicationRule.builder().ruleId(ruleId).subject(subject)
				.condition(condition).severity(Severity.fromToken(cell(row, "SEVERITY")))
				.reason(cell(row, "REASON")).alternatives(alternatives).qualifier(qualifier).threshold(threshold)
				.absolute(parseFlag(cell(row, "ABSOLUTE"))).build();
		contraindications.computeIfAbsent(subject, k -> new ArrayList<>()).add(rule);
	}

	// ------------------------------------------------------------------
	// Helpers
	// ------------------------------------------------------------------

	private boolean claimRuleId(String ruleId, String where) {
		if (ruleId.isEmpty()) {
			issues.add(where + ": blank RULE_ID");
			return false;
		}
		if (!ruleIds.add(ruleId)) {
			issues.add(where + ": duplicate rule id '" + ruleId + "'");
			return false;
		}
		return true;
	}

	private boolean requireDefined(String id, String column, String where) {
		if (id.isEmpty()) {
			issues.add(where + ": blank " + column);
			return false;
		}
		if (!isDefined(id)) {
			issues.add(where + ": undefined identifier '" + id + "' in " + column);
			return false;
		}
		return true;
	}

	private boolean isDefined(String id) {
		return drugs.containsKey(id) || tags.contains(id);
	}

	private static String cell(CSVRecord row, String column) {
		if (!row.isSet(column)) {
			return "";
		}
		String v = row.get(column);
		return v == null ? "" : v.trim();
	}

	private static List<String> split(String cell) {
		List<String> out = new ArrayList<>();
		for (String part : StringUtils.split(cell, LIST_SEPARATOR)) {
			String p = part.trim();
			if (!p.isEmpty()) {
				out.add(p);
			}
		}
		return out;
	}

	/** Blank is false; otherwise one of true/false, yes/no, y/n, 1/0. */
	static boolean parseFlag(String raw) {
		if (raw == null || raw.isBlank()) {
			return false;
		}
		switch (raw.trim().toLowerCase(Locale.ROOT)) {
		case "true":
		case "yes":
		case "y":
		case "1":
			return true;
		case "false":
		case "no":
		case "n":
		case "0":
			return false;
		default:
			throw new IllegalArgumentException("invalid flag '" + raw.trim() + "'");
		}
	}
}
