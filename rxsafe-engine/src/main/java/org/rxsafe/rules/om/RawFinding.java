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

import lombok.Builder;
import lombok.Value;

/**
 * Uniform output of every rule evaluator. The aggregator treats all kinds
 * the same way: group by {@link #getKey()}, keep the strongest, sort.
 */
@Value
@Builder
public class RawFinding {

	AlertKey key;
	Severity severity;

	/** Null for findings that are not backed by a graded rule. */
	EvidenceLevel evidence;

	/** Set when the backing rule is marked absolute (cannot be overridden). */
	boolean absolute;

	String title;
	String message;
	AlertDetails details;

	/** Rule that produced the finding; null for derived findings. */
	String ruleId;

	public AlertKind getKind() {
		return key.getKind();
	}

	public EvidenceLevel evidenceOrDefault() {
		return evidence == null ? EvidenceLevel.MODERATE : evidence;
	}
}
