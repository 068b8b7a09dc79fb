/*
 * AddressError.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * The reason an email address, local-part or domain was rejected.
 * Validation stops at the first violation, so exactly one of these is
 * reported per failed attempt.
 *
 * <p>Some constants are reserved: no validator in this package currently
 * produces {@link #DOMAIN_TOO_FEW}, {@link #DOMAIN_INVALID_SEPARATOR},
 * {@link #UNBALANCED_QUOTES}, {@link #INVALID_COMMENT},
 * {@link #INVALID_IP_ADDRESS} or {@link #INTERNAL_ERROR}. Misplaced dots and
 * stray quotes are reported as {@link #INVALID_CHARACTER}.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum AddressError {

	/** An invalid character was found in the local-part or domain. */
	INVALID_CHARACTER("err.invalid_character"),

	/** The '@' separator between local-part and domain is missing. */
	MISSING_SEPARATOR("err.missing_separator", AddrSpecSyntax.AT),

	/** The local-part is empty, or is an empty quoted-string. */
	LOCAL_PART_EMPTY("err.local_part_empty"),

	/** The local-part is longer than 64 code points. */
	LOCAL_PART_TOO_LONG("err.local_part_too_long",
			EmailAddressParser.LOCAL_PART_MAX_LENGTH),

	/** The domain is empty. */
	DOMAIN_EMPTY("err.domain_empty"),

	/** The domain is longer than 254 code points. */
	DOMAIN_TOO_LONG("err.domain_too_long",
			EmailAddressParser.DOMAIN_MAX_LENGTH),

	/** A label of a dot-atom domain is longer than 63 code points. */
	SUB_DOMAIN_TOO_LONG("err.sub_domain_too_long",
			EmailAddressParser.SUB_DOMAIN_MAX_LENGTH),

	/** Too few labels in the domain. Reserved. */
	DOMAIN_TOO_FEW("err.domain_too_few"),

	/** Invalid placement of the domain separator '.'. Reserved. */
	DOMAIN_INVALID_SEPARATOR("err.domain_invalid_separator", AddrSpecSyntax.DOT),

	/** The quotes around the local-part are unbalanced. Reserved. */
	UNBALANCED_QUOTES("err.unbalanced_quotes"),

	/** A comment was malformed. Reserved, comments are not supported. */
	INVALID_COMMENT("err.invalid_comment"),

	/** An IP address in a domain-literal was malformed. Reserved. */
	INVALID_IP_ADDRESS("err.invalid_ip_address"),

	/** An internal invariant was violated. */
	INTERNAL_ERROR("err.internal_error");

	static final ResourceBundle L10N =
			ResourceBundle.getBundle("org.bluezoo.addrspec.L10N");

	private final String key;
	private final Object[] arguments;

	AddressError(String key, Object... arguments) {
		this.key = key;
		this.arguments = arguments;
	}

	/**
	 * Returns the resource key of the message for this error.
	 * @return the L10N key
	 */
	public String getKey() {
		return key;
	}

	/**
	 * Returns a one-line human-readable description of this error.
	 * @return the localized message
	 */
	public String getMessage() {
		String pattern = L10N.getString(key);
		return MessageFormat.format(pattern, arguments);
	}

}
