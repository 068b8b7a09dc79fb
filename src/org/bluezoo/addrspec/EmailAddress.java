/*
 * EmailAddress.java
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

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.text.MessageFormat;

/**
 * A validated Internet email address (RFC 5322 addr-spec).
 *
 * <p>Instances are obtained from {@link EmailAddressParser#parse} and are
 * immutable. The local-part and domain are kept exactly as they appeared
 * in the input, including the quotes of a quoted-string and the brackets
 * of a domain-literal, so that {@link #getAddress()} always re-parses to an
 * equal instance.
 *
 * <p>Equality is exact on both parts: no case folding is applied to either
 * the local-part or the domain.
 *
 * @see <a href='https://datatracker.ietf.org/doc/html/rfc5322#section-3.4.1'>RFC 5322</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class EmailAddress implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String localPart;
	private final String domain;

	/**
	 * Constructor. Both parts must already have been validated.
	 * @param localPart the local-part of the mailbox (before the '@')
	 * @param domain the domain of the mailbox (after the '@')
	 */
	EmailAddress(String localPart, String domain) {
		if (localPart == null || domain == null) {
			throw new NullPointerException("localPart and domain must not be null");
		}
		this.localPart = localPart;
		this.domain = domain;
	}

	/**
	 * Returns the local-part of the address (the part before the '@').
	 * A quoted local-part retains its quotes and escapes.
	 * @return the local-part
	 */
	public String getLocalPart() {
		return localPart;
	}

	/**
	 * Returns the domain of the address (the part after the '@').
	 * A domain-literal retains its brackets.
	 * @return the domain
	 */
	public String getDomain() {
		return domain;
	}

	/**
	 * Returns the canonical form local-part@domain.
	 * @return the address
	 */
	public String getAddress() {
		return localPart + AddrSpecSyntax.AT + domain;
	}

	/**
	 * Indicates whether the local-part is a quoted-string.
	 * @return true if the local-part is enclosed in double quotes
	 */
	public boolean isQuotedLocalPart() {
		return EmailAddressParser.isEnclosed(localPart, AddrSpecSyntax.DQUOTE, AddrSpecSyntax.DQUOTE);
	}

	/**
	 * Indicates whether the domain is a domain-literal.
	 * @return true if the domain is enclosed in square brackets
	 */
	public boolean isDomainLiteral() {
		return EmailAddressParser.isEnclosed(domain, AddrSpecSyntax.LBRACKET, AddrSpecSyntax.RBRACKET);
	}

	/**
	 * Returns this address as a mailto URI. Reserved characters in the
	 * address, including the '@', are percent-encoded, so
	 * {@code name@example.org} becomes {@code mailto:name%40example.org}.
	 * @return the URI string
	 */
	public String toURI() {
		return MailtoEncoder.MAILTO_URI_PREFIX + MailtoEncoder.encode(getAddress());
	}

	/**
	 * Returns this address with a display name, in the form used in
	 * message headers: {@code My Name <name@example.org>}.
	 * The display name is used as given, without quoting or encoding.
	 * @param displayName the display name. Cannot be null
	 * @return the formatted address
	 */
	public String toDisplay(String displayName) {
		if (displayName == null) {
			throw new NullPointerException("displayName must not be null");
		}
		StringBuilder sb = new StringBuilder();
		sb.append(displayName).append(' ');
		sb.append(AddrSpecSyntax.LT).append(getAddress()).append(AddrSpecSyntax.GT);
		return sb.toString();
	}

	@Override
	public int hashCode() {
		return localPart.hashCode() * 31 + domain.hashCode();
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof EmailAddress)) {
			return false;
		}
		EmailAddress o = (EmailAddress) other;
		return localPart.equals(o.localPart) && domain.equals(o.domain);
	}

	@Override
	public String toString() {
		return getAddress();
	}

	private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
		in.defaultReadObject();
		if (localPart == null || domain == null) {
			throw new InvalidObjectException("localPart and domain must not be null");
		}
		AddressError error = EmailAddressParser.checkLocalPart(localPart);
		if (error == null) {
			error = EmailAddressParser.checkDomain(domain);
		}
		// A domain-literal may hold '@' but a parsed domain never does
		if (error == null && domain.indexOf(AddrSpecSyntax.AT) >= 0) {
			error = AddressError.INVALID_CHARACTER;
		}
		if (error != null) {
			String msg = AddressError.L10N.getString("err.invalid_serialized_address");
			throw new InvalidObjectException(MessageFormat.format(msg, getAddress(), error.getMessage()));
		}
	}

}
