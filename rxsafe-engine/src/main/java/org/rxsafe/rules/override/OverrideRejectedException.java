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

/**
 * An override decision was refused. Recoverable: the caller re-presents the
 * dialog to the clinician; nothing was recorded.
 */
public class OverrideRejectedException extends Exception {

	private static final long serialVersionUID = 1L;

	private final transient Alert alert;

	public OverrideRejectedException(String message, Alert alert) {
		super(message);
		this.alert = alert;
	}

	public Alert getAlert() {
		return alert;
	}
}
