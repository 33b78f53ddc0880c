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

public enum Gender {
	FEMALE, MALE, OTHER, UNKNOWN;

	/** Lenient parse: "F", "female", "M", "male", anything else maps to OTHER/UNKNOWN. */
	public static Gender parse(String s) {
		if (s == null || s.isBlank())
			return UNKNOWN;
		String v = s.trim().toLowerCase(Locale.ROOT);
		if (v.equals("f") || v.equals("female"))
			return FEMALE;
		if (v.equals("m") || v.equals("male"))
			return MALE;
		return OTHER;
	}
}
