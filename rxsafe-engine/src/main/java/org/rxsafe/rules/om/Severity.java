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
 * Alert and rule severity. Totally ordered: CRITICAL > MAJOR > MODERATE > MINOR.
 * Declaration order is most severe first, so {@link #compareTo} sorts
 * critical-first.
 */
public enum Severity {

	CRITICAL, MAJOR, MODERATE, MINOR;

	/** True if this severity is at least as severe as {@code other}. */
	public boolean isAtLeast(Severity other) {
		return this.ordinal() <= other.ordinal();
	}

	public static Severity mostSevere(Severity a, Severity b) {
		return a.ordinal() <= b.ordinal() ? a : b;
	}

	/**
	 * Parse a data-file token (critical, major, moderate, minor; any case).
	 *
	 * @throws IllegalArgumentException on any other token
	 */
	public static Severity fromToken(String token) {
		if (token == null || token.isBlank()) {
			throw new IllegalArgumentException("blank severity");
		}
		try {
			return Severity.valueOf(token.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("invalid severity token '" + token.trim() + "'");
		}
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
