/*
 * EmailAddressException.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of addrspec, an Internet email address library.
 *
 * addrspec is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * addrspec is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with addrspec.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.addrspec;

/**
 * An exception indicating that a string is not a valid email address.
 * The {@link AddressError} gives the first violation found.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EmailAddressException extends Exception {

	private static final long serialVersionUID = 1L;

	private final AddressError error;
	private final String input;

	/**
	 * Constructs a new exception for the specified error.
	 * @param error the reason the input was rejected. Cannot be null
	 * @param input the rejected input. May be null
	 */
	public EmailAddressException(AddressError error, String input) {
		super(error.getMessage());
		this.error = error;
		this.input = input;
	}

	/**
	 * Returns the reason the input was rejected.
	 * @return the error
	 */
	public AddressError getError() {
		return error;
	}

	/**
	 * Returns the input that was rejected.
	 * @return the input, or null if not recorded
	 */
	public String getInput() {
		return input;
	}

}
