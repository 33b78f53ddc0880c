package org.rxsafe.rules.override;

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

import org.rxsafe.rules.om.Alert;

/** Proceeding past this alert needs a documented reason and none was given. */
public class MissingReasonException extends OverrideRejectedException {

	private static final long serialVersionUID = 1L;

	public MissingReasonException(Alert alert) {
		super("A reason is required to proceed past " + alert.getKey(), alert);
	}
}
