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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strips dose, regimen and salt text from prescription-style drug strings so
 * that "Warfarin 5mg OD" or "Metformin HCl 500 mg tablet" can be resolved
 * against the alias index.
 */
public final class DoseText {
	private DoseText() {
	}

	// Units we’ll remove when paired with a number
	private static final String UNITS = "(?:mg|g|mcg|μg|µg|ug|ng|kg|iu|unit(?:s)?|u|meq|mmol|ml|l|%)";

	// 120 mg/5 mL, 10,000 units/mL, 0.1 mg per 5 mL, 2 mg/kg
	private static final Pattern COMPOSITE = Pattern.compile("\\b\\d[\\d,]*(?:\\.\\d+)?\\s*-?\\s*" + UNITS
			+ "\\s*(?:/|per)\\s*\\d[\\d,]*(?:\\.\\d+)?\\s*-?\\s*(?:" + UNITS + "|m2|m\\^2|kg|hr|h|day|d)\\b",
			Pattern.CASE_INSENSITIVE);

	// 10–20 mg, 10-20 mg (range strength)
	private static final Pattern RANGE = Pattern.compile(
			"\\b\\d[\\d,]*(?:\\.\\d+)?\\s*(?:[-–]\\s*\\d[\\d,]*(?:\\.\\d+)?)\\s*" + UNITS + "\\b",
			Pattern.CASE_INSENSITIVE);

	// Simple strength: 100 mg, 100mg, 100-mg, 5%
	private static final Pattern SIMPLE = Pattern.compile("\\b\\d[\\d,]*(?:\\.\\d+)?\\s*-?\\s*" + UNITS + "(?:\\b|(?<=%))",
			Pattern.CASE_INSENSITIVE);

	// Frequency and route abbreviations as written on Indian and UK prescriptions
	private static final Pattern REGIMEN = Pattern.compile(
			"\\b(?:od|bd|bid|tds|tid|qid|qds|hs|sos|prn|stat|qd|qhs|once|twice|thrice|daily|weekly|"
					+ "morning|night|at bedtime|as needed|po|iv|im|sc)\\b",
			Pattern.CASE_INSENSITIVE);

	// Dosage-form words
	private static final Pattern FORM = Pattern.compile(
			"\\b(?:tab(?:let)?s?|cap(?:sule)?s?|syrup|susp(?:ension)?|inj(?:ection)?|drops?|cream|gel|"
					+ "ointment|sr|er|xr|cr|mr|dt)\\b",
			Pattern.CASE_INSENSITIVE);

	// Trailing salt / ester words: "metformin hcl", "diclofenac sodium"
	private static final Pattern SALT_SUFFIX = Pattern.compile(
			"(?:\\s+(?:hcl|hydrochloride|sodium|potassium|calcium|besylate|besilate|maleate|mesylate|"
					+ "succinate|tartrate|citrate|sulfate|sulphate|phosphate|acetate|bromide|fumarate))+$",
			Pattern.CASE_INSENSITIVE);

	// Bare numbers left after "1 tab" style quantities
	private static final Pattern BARE_NUMBER = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");

	// Collapse any whitespace (incl. NBSP)
	private static final Pattern WS = Pattern.compile("[\\s\\u00A0]+");

	// Separators folded to '_' in identifiers
	private static final Pattern ID_SEPARATORS = Pattern.compile("[\\s\\-]+");

	// Strip punctuation that can be left dangling after removals
	private static final Pattern PUNCT_GAPS = Pattern.compile("[\\(\\)\\[\\]\\{\\},;:/]+");

	/**
	 * Lower-case, trim and collapse internal whitespace. Null becomes "".
	 */
	public static String normalizeKey(String s) {
		if (s == null)
			return "";
		return WS.matcher(s).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Identifier form used for drug ids, class tags and conditions: a
	 * normalized key with whitespace and hyphens folded to underscores.
	 * "CKD Stage-4" becomes "ckd_stage_4".
	 */
	public static String toIdentifier(String s) {
		return ID_SEPARATORS.matcher(normalizeKey(s)).replaceAll("_");
	}

	/**
	 * Remove common dose/strength patterns from a drug string.
	 */
	public static String removeUnits(String s) {
		if (s == null || s.isEmpty())
			return s;

		String out = s;

		// Normalize whitespace early (helps regexes)
		out = WS.matcher(out).replaceAll(" ").trim();

		// Remove composite/range forms first (most specific)
		out = COMPOSITE.matcher(out).replaceAll(" ");
		out = RANGE.matcher(out).replaceAll(" ");

		// Then remove simple numeric + unit
		out = SIMPLE.matcher(out).replaceAll(" ");

		// Clean leftover punctuation/parentheses and repeated spaces
		out = PUNCT_GAPS.matcher(out).replaceAll(" ");
		out = WS.matcher(out).replaceAll(" ").trim();

		return out;
	}

	/**
	 * Remove strength, frequency, route and dosage-form text, e.g.
	 * "Aspirin 325mg OD" -> "aspirin", "Amoxicillin 500 mg cap TDS" -> "amoxicillin".
	 * The result is a normalized key.
	 */
	public static String removeRegimen(String s) {
		if (s == null || s.isBlank())
			return "";
		String out = removeUnits(s);
		out = REGIMEN.matcher(out).replaceAll(" ");
		out = FORM.matcher(out).replaceAll(" ");
		out = BARE_NUMBER.matcher(out).replaceAll(" ");
		return normalizeKey(out);
	}

	/**
	 * Drop trailing salt words: "metformin hcl" -> "metformin". A string made
	 * only of a salt word is returned unchanged.
	 */
	public static String removeSalt(String s) {
		String key = normalizeKey(s);
		String stripped = SALT_SUFFIX.matcher(key).replaceAll("").trim();
		return stripped.isEmpty() ? key : stripped;
	}
}
