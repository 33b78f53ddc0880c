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

/** Strength of the evidence behind a rule, strongest first. */
public enum EvidenceLevel {

	HIGH, MODERATE, LOW;

	/**
	 * Parse a data-file token. A blank cell means {@link #MODERATE}.
	 *
	 * @throws IllegalArgumentException on an unknown token
	 */
	public static EvidenceLevel fromToken(String token) {
		if (token == null || token.isBlank()) {
			return MODERATE;
		}
		try {
			return EvidenceLevel.valueOf(token.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("invalid evidence token '" + token.trim() + "'");
		}
	}
}
