/*
 * MailtoEncoder.java
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
 * Percent-encoder for the address portion of a mailto URI.
 *
 * <p>Only the RFC 3986 reserved characters
 * {@code !#$%&'()*+,/:;=?@[]} are escaped. All other characters,
 * including non-ASCII, are copied unchanged.
 *
 * @see <a href='https://datatracker.ietf.org/doc/html/rfc6068'>RFC 6068</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MailtoEncoder {

	/** URI scheme prefix for email addresses. */
	public static final String MAILTO_URI_PREFIX = "mailto:";

	private static final char[] HEX = "0123456789ABCDEF".toCharArray();

	private MailtoEncoder() {
		// Static utility class
	}

	/**
	 * Percent-encodes the reserved characters in a string.
	 * @param s the string to encode
	 * @return the encoded string
	 */
	public static String encode(String s) {
		StringBuilder buf = null;
		int len = s.length();
		for (int i = 0; i < len; i++) {
			char c = s.charAt(i);
			if (isURIReserved(c)) {
				if (buf == null) {
					buf = new StringBuilder(len + 16);
					buf.append(s, 0, i);
				}
				buf.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0f]);
			} else if (buf != null) {
				buf.append(c);
			}
		}
		return buf == null ? s : buf.toString();
	}

	/**
	 * Checks if a code point is escaped in a mailto URI.
	 * @param c the code point to check
	 * @return true if the code point is percent-encoded by {@link #encode}
	 */
	public static boolean isURIReserved(int c) {
		switch (c) {
			case '!': case '#': case '$': case '%': case '&': case '\'':
			case '(': case ')': case '*': case '+': case ',': case '/':
			case ':': case ';': case '=': case '?': case '@': case '[':
			case ']':
				return true;
			default:
				return false;
		}
	}

}
