/*
 * EmailAddressParser.java
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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RFC 5322 addr-spec parser with RFC 6531/6532 internationalization.
 *
 * <p>Accepts a bare {@code local-part@domain}, optionally enclosed in a
 * single pair of angle brackets. The local-part is either dot-atom-text or
 * a quoted-string; the domain is either dot-atom-text or a domain-literal.
 * Display names, comments and folding whitespace are not accepted.
 *
 * <p>The input is split at the last '@', since the domain can never contain
 * one but a quoted local-part can, e.g. {@code "Abc@def"@example.com}.
 *
 * <p>The {@code check} methods report the first violation found, or null
 * if the input is valid. Lengths are counted in Unicode code points.
 *
 * <p>This class cannot be instantiated. All methods are static.
 *
 * @see <a href='https://datatracker.ietf.org/doc/html/rfc5322#section-3.4.1'>RFC 5322</a>
 * @see <a href='https://datatracker.ietf.org/doc/html/rfc3696#section-3'>RFC 3696</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class EmailAddressParser {

	private static final Logger LOGGER =
			Logger.getLogger(EmailAddressParser.class.getName());

	/** Maximum length of a local-part (RFC 5321 section 4.5.3.1.1). */
	public static final int LOCAL_PART_MAX_LENGTH = 64;

	/** Maximum length of a domain (RFC 3696 erratum 1690). */
	public static final int DOMAIN_MAX_LENGTH = 254;

	/** Maximum length of a single domain label (RFC 1035). */
	public static final int SUB_DOMAIN_MAX_LENGTH = 63;

	/** Prevents instantiation. */
	private EmailAddressParser() {
	}

	/**
	 * Parse an email address.
	 *
	 * @param address the address, e.g. "user@example.com" or
	 *        "&lt;user@example.com&gt;"
	 * @return the parsed address
	 * @throws EmailAddressException if the address is not valid
	 */
	public static EmailAddress parse(String address) throws EmailAddressException {
		AddressError error = checkAddress(address);
		if (error != null) {
			if (LOGGER.isLoggable(Level.FINE)) {
				String msg = AddressError.L10N.getString("log.address_rejected");
				LOGGER.fine(MessageFormat.format(msg, escapeControls(address), error.getMessage()));
			}
			throw new EmailAddressException(error, address);
		}
		String addrSpec = stripAngleBrackets(address);
		int atPos = addrSpec.lastIndexOf(AddrSpecSyntax.AT);
		return new EmailAddress(addrSpec.substring(0, atPos), addrSpec.substring(atPos + 1));
	}

	/**
	 * Indicates whether a string is a valid email address. This is
	 * equivalent to {@link #parse} succeeding.
	 *
	 * @param address the address to test
	 * @return true if the address is valid, false if not or if null
	 */
	public static boolean isValid(String address) {
		return address != null && checkAddress(address) == null;
	}

	/**
	 * Indicates whether a string would be a valid local-part.
	 *
	 * @param part the candidate local-part, without the '@'
	 * @return true if valid, false if not or if null
	 */
	public static boolean isValidLocalPart(String part) {
		return part != null && checkLocalPart(part) == null;
	}

	/**
	 * Indicates whether a string would be a valid domain.
	 *
	 * @param part the candidate domain, without the '@'
	 * @return true if valid, false if not or if null
	 */
	public static boolean isValidDomain(String part) {
		return part != null && checkDomain(part) == null;
	}

	/**
	 * Validate an email address.
	 *
	 * @param address the address to validate. Cannot be null
	 * @return the first violation found, or null if the address is valid
	 */
	public static AddressError checkAddress(String address) {
		if (address == null) {
			throw new NullPointerException("address must not be null");
		}
		String addrSpec = stripAngleBrackets(address);
		int atPos = addrSpec.lastIndexOf(AddrSpecSyntax.AT);
		if (atPos < 0) {
			return AddressError.MISSING_SEPARATOR;
		}
		AddressError error = checkLocalPart(addrSpec.substring(0, atPos));
		if (error != null) {
			return error;
		}
		return checkDomain(addrSpec.substring(atPos + 1));
	}

	/**
	 * Validate a local-part. A local-part that begins and ends with a
	 * double quote is a quoted-string and must contain only qcontent and
	 * WSP; anything else must be dot-atom-text.
	 *
	 * @param part the candidate local-part. Cannot be null
	 * @return the first violation found, or null if the local-part is valid
	 */
	public static AddressError checkLocalPart(String part) {
		if (part == null) {
			throw new NullPointerException("local-part must not be null");
		}
		if (part.isEmpty()) {
			return AddressError.LOCAL_PART_EMPTY;
		}
		if (length(part) > LOCAL_PART_MAX_LENGTH) {
			return AddressError.LOCAL_PART_TOO_LONG;
		}
		if (isEnclosed(part, AddrSpecSyntax.DQUOTE, AddrSpecSyntax.DQUOTE)) {
			if (part.length() == 2) {
				return AddressError.LOCAL_PART_EMPTY;
			}
			if (!AddrSpecSyntax.isQcontent(part.substring(1, part.length() - 1))) {
				return AddressError.INVALID_CHARACTER;
			}
			return null;
		}
		if (!AddrSpecSyntax.isDotAtomText(part)) {
			return AddressError.INVALID_CHARACTER;
		}
		return null;
	}

	/**
	 * Validate a domain. A domain that begins with '[' and ends with ']' is
	 * a domain-literal whose body must be dtext; anything else must be
	 * dot-atom-text with no label longer than 63 code points.
	 *
	 * <p>Domain-literals are checked only for dtext characters. No IPv4
	 * or IPv6 structure is verified, and {@code []} is accepted.
	 *
	 * @param part the candidate domain. Cannot be null
	 * @return the first violation found, or null if the domain is valid
	 */
	public static AddressError checkDomain(String part) {
		if (part == null) {
			throw new NullPointerException("domain must not be null");
		}
		if (part.isEmpty()) {
			return AddressError.DOMAIN_EMPTY;
		}
		if (length(part) > DOMAIN_MAX_LENGTH) {
			return AddressError.DOMAIN_TOO_LONG;
		}
		if (isEnclosed(part, AddrSpecSyntax.LBRACKET, AddrSpecSyntax.RBRACKET)) {
			if (!AddrSpecSyntax.isDtext(part.substring(1, part.length() - 1))) {
				return AddressError.INVALID_CHARACTER;
			}
			return null;
		}
		if (!AddrSpecSyntax.isDotAtomText(part)) {
			return AddressError.INVALID_CHARACTER;
		}
		int labelStart = 0;
		int len = part.length();
		for (int i = 0; i <= len; i++) {
			if (i == len || part.charAt(i) == AddrSpecSyntax.DOT) {
				if (part.codePointCount(labelStart, i) > SUB_DOMAIN_MAX_LENGTH) {
					return AddressError.SUB_DOMAIN_TOO_LONG;
				}
				labelStart = i + 1;
			}
		}
		return null;
	}

	// -- Utilities --

	/**
	 * Removes one enclosing pair of angle brackets, if present.
	 */
	static String stripAngleBrackets(String address) {
		if (isEnclosed(address, AddrSpecSyntax.LT, AddrSpecSyntax.GT)) {
			return address.substring(1, address.length() - 1);
		}
		return address;
	}

	/**
	 * A single character is never enclosed, even if it matches both ends.
	 */
	static boolean isEnclosed(String s, char open, char close) {
		int len = s.length();
		return len >= 2 && s.charAt(0) == open && s.charAt(len - 1) == close;
	}

	/**
	 * Replaces control characters with Java-style unicode escapes, keeping
	 * a logged address on one line.
	 */
	static String escapeControls(String s) {
		StringBuilder buf = null;
		int len = s.length();
		for (int i = 0; i < len; i++) {
			char c = s.charAt(i);
			if (Character.isISOControl(c)) {
				if (buf == null) {
					buf = new StringBuilder(len + 16);
					buf.append(s, 0, i);
				}
				buf.append(String.format("\\u%04X", (int) c));
			} else if (buf != null) {
				buf.append(c);
			}
		}
		return (buf == null) ? s : buf.toString();
	}

	private static int length(String s) {
		return s.codePointCount(0, s.length());
	}

}
