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

import lombok.Value;

/**
 * Identity of an alert: its kind plus the literal subject it is about
 * ({@code ibuprofen+warfarin}, {@code metformin@ckd_stage4},
 * {@code amoxicillin|beta_lactams}, a class tag, or an unrecognized term).
 * Findings with equal keys collapse into one alert.
 */
@Value
public class AlertKey implements Comparable<AlertKey> {

	AlertKind kind;
	String subject;

	public static AlertKey of(AlertKind kind, String subject) {
		return new AlertKey(kind, subject);
	}

	public static AlertKey forPair(AlertKind kind, String drugA, String drugB) {
		return new AlertKey(kind, PairKey.of(drugA, drugB).toString());
	}

	public static AlertKey forCondition(AlertKind kind, String drug, String condition) {
		return new AlertKey(kind, drug + "@" + condition);
	}

	public static AlertKey forGroup(AlertKind kind, String drug, String group) {
		return new AlertKey(kind, drug + "|" + group);
	}

	@Override
	public int compareTo(AlertKey o) {
		int c = Integer.compare(kind.getPriority(), o.kind.getPriority());
		if (c != 0)
			return c;
		c = kind.compareTo(o.kind);
		return c != 0 ? c : subject.compareTo(o.subject);
	}

	@Override
	public String toString() {
		return kind.label() + ":" + subject;
	}
}
