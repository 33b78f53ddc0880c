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

import java.util.Objects;

/**
 * Order-independent pair of identifiers. {@code PairKey.of(a, b)} equals
 * {@code PairKey.of(b, a)}; {@link #getFirst()} is always the lexically
 * smaller member.
 */
public final class PairKey implements Comparable<PairKey> {

	private final String first;
	private final String second;

	private PairKey(String first, String second) {
		this.first = first;
		this.second = second;
	}

	public static PairKey of(String a, String b) {
		Objects.requireNonNull(a, "a");
		Objects.requireNonNull(b, "b");
		return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
	}

	public String getFirst() {
		return first;
	}

	public String getSecond() {
		return second;
	}

	public boolean contains(String id) {
		return first.equals(id) || second.equals(id);
	}

	@Override
	public int compareTo(PairKey o) {
		int c = first.compareTo(o.first);
		return c != 0 ? c : second.compareTo(o.second);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof PairKey))
			return false;
		PairKey other = (PairKey) o;
		return first.equals(other.first) && second.equals(other.second);
	}

	@Override
	public int hashCode() {
		return 31 * first.hashCode() + second.hashCode();
	}

	@Override
	public String toString() {
		return first + "+" + second;
	}
}
