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
 * Drug-drug interaction between two drug-or-class identifiers. The pair is
 * unordered: a rule declared as (A,B) matches (B,A).
 */
@Value
@Builder
public class InteractionRule {

	String ruleId;

	/** Subjects as declared in the data file. Use {@link #getPair()} for matching. */
	String subjectA;
	String subjectB;

	Severity severity;
	String mechanism;
	String clinicalEffect;
	String management;
	EvidenceLevel evidence;

	/** Absolute rules cannot be overridden. */
	boolean absolute;

	public PairKey getPair() {
		return PairKey.of(subjectA, subjectB);
	}
}
