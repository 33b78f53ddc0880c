package org.rxsafe.rules.reference;

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

import java.util.List;

/**
 * Reference data is malformed or inconsistent. Fatal at startup: the engine
 * never runs on partially loaded indices.
 */
public class DataLoadException extends Exception {

	private static final long serialVersionUID = 1L;

	private final List<String> issues;

	public DataLoadException(List<String> issues) {
		super(summarize(issues));
		this.issues = List.copyOf(issues);
	}

	public DataLoadException(String issue, Throwable cause) {
		super(issue, cause);
		this.issues = List.of(issue);
	}

	/** Every problem found, in file order. */
	public List<String> getIssues() {
		return issues;
	}

	private static String summarize(List<String> issues) {
		if (issues == null || issues.isEmpty()) {
			return "Reference data failed validation";
		}
		StringBuilder sb = new StringBuilder();
		sb.append("Reference data failed validation with ").append(issues.size()).append(" issue(s): ")
				.append(issues.get(0));
		if (issues.size() > 1) {
			sb.append(" (and ").append(issues.size() - 1).append(" more)");
		}
		return sb.toString();
	}
}
