package org.rxsafe.rules.processing.evaluate;

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

import org.rxsafe.rules.om.RawFinding;

/**
 * One independent rule source. Implementations hold only the shared read-only
 * reference store and configuration, so a single instance may evaluate many
 * checks concurrently.
 */
public interface RuleEvaluator {

	/** Short name used in logs and in the "evaluator unavailable" finding. */
	String name();

	/**
	 * Evaluate one prescription check. Unrecognized inputs are already flagged
	 * by the pipeline and should be skipped here.
	 */
	List<RawFinding> evaluate(EvaluationContext ctx);
}
