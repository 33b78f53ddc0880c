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

import java.util.Locale;

/**
 * Patient-context filter attached to a contraindication rule. A qualified rule
 * also fires from demographics or labs, not only from a listed condition.
 */
public enum RuleQualifier {

	/** Plain drug-condition contraindication. */
	NONE(AlertKind.CONTRAINDICATION),
	/** Fires when eGFR is below the rule threshold. */
	RENAL(AlertKind.RENAL),
	/** Fires when the patient is pregnant. */
	PREGNANCY(AlertKind.PREGNANCY),
	/** Fires when age is at or above the rule threshold. */
	GERIATRIC(AlertKind.GERIATRIC);

	private final AlertKind alertKind;

	RuleQualifier(AlertKind alertKind) {
		this.alertKind = alertKind;
	}

	public AlertKind getAlertKind() {
		return alertKind;
	}

	public boolean requiresThreshold() {
		return this == RENAL || this == GERIATRIC;
	}

	public static RuleQualifier fromToken(String token) {
		if (token == null || token.isBlank()) {
			return NONE;
		}
		try {
			return RuleQualifier.valueOf(token.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("invalid qualifier token '" + token.trim() + "'");
		}
	}
}
