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
 * Kind of clinical alert. {@link #getPriority()} is the secondary sort key
 * after severity.
 */
public enum AlertKind {

	INTERACTION(0),
	CONTRAINDICATION(1),
	ALLERGY(2),
	CROSS_ALLERGY(2),
	DUPLICATE_THERAPY(3),
	RENAL(4),
	PREGNANCY(4),
	GERIATRIC(4),
	/** Coverage gap: a drug, allergy or condition the reference data does not know. */
	UNRECOGNIZED(5);

	private final int priority;

	AlertKind(int priority) {
		this.priority = priority;
	}

	public int getPriority() {
		return priority;
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
