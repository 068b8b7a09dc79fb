/*
 * AddrSpecSyntax.java
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
 * Character classes and token recognizers for the RFC 5322 addr-spec
 * grammar, as extended by RFC 6531/6532 for internationalized addresses.
 *
 * <p>Character predicates operate on Unicode code points. Every Unicode
 * scalar value at or above U+0080 is accepted wherever the RFC 6532
 * UTF8-non-ascii extension applies (atext, qtext). Unpaired surrogates
 * cannot be encoded in UTF-8 and are rejected. The dtext class here is
 * ASCII only.
 *
 * <p>Folding whitespace, comments and the obsolete productions are not
 * recognized.
 *
 * @see <a href='https://datatracker.ietf.org/doc/html/rfc5322#section-3.2.3'>RFC 5322</a>
 * @see <a href='https://datatracker.ietf.org/doc/html/rfc6532#section-3.2'>RFC 6532</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class AddrSpecSyntax {

	/** Separator between local-part and domain. */
	public static final char AT = '@';
	/** Separator between atoms in a dot-atom. */
	public static final char DOT = '.';
	public static final char DQUOTE = '"';
	public static final char ESC = '\\';
	public static final char LBRACKET = '[';
	public static final char RBRACKET = ']';
	public static final char LT = '<';
	public static final char GT = '>';
	public static final char SP = ' ';
	public static final char HTAB = '\t';

	/** First code point of the UTF8-non-ascii range. */
	public static final int UTF8_START = 0x80;

	private AddrSpecSyntax() {
		// Static utility class
	}

	// -- Character classes --

	/**
	 * Checks if a code point is atext: an ASCII letter or digit, one of
	 * {@code !#$%&'*+-/=?^_`{|}~}, or a UTF8-non-ascii code point.
	 * @param c the code point to check
	 * @return true if the code point may appear in an atom
	 */
	public static boolean isAtext(int c) {
		if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ||
		    (c >= '0' && c <= '9')) {
			return true;
		}
		switch (c) {
			case '!': case '#': case '$': case '%': case '&': case '\'':
			case '*': case '+': case '-': case '/': case '=': case '?':
			case '^': case '_': case '`': case '{': case '|': case '}':
			case '~':
				return true;
			default:
				return isUchar(c);
		}
	}

	/**
	 * Checks if a code point belongs to the RFC 6532 UTF8-non-ascii
	 * extension. A Java string may hold an unpaired surrogate, which
	 * {@link String#codePointAt} returns as is; such a value is not a
	 * Unicode scalar value and has no UTF-8 encoding.
	 * @param c the code point to check
	 * @return true if the code point is U+0080 or above and not a surrogate
	 */
	public static boolean isUchar(int c) {
		return c >= UTF8_START
				&& (c < Character.MIN_SURROGATE || c > Character.MAX_SURROGATE);
	}

	/**
	 * Checks if a code point is a visible (printing) ASCII character,
	 * %x21-7E.
	 * @param c the code point to check
	 * @return true if the code point is VCHAR
	 */
	public static boolean isVchar(int c) {
		return c >= 0x21 && c <= 0x7e;
	}

	/**
	 * Checks if a code point is WSP (space or horizontal tab).
	 * @param c the code point to check
	 * @return true if the code point is WSP
	 */
	public static boolean isWsp(int c) {
		return c == SP || c == HTAB;
	}

	/**
	 * Checks if a code point is qtext: printable ASCII except the double
	 * quote and backslash, or a UTF8-non-ascii code point.
	 * @param c the code point to check
	 * @return true if the code point may appear unescaped in a quoted-string
	 */
	public static boolean isQtextChar(int c) {
		return c == 0x21 ||
		       (c >= 0x23 && c <= 0x5b) ||
		       (c >= 0x5d && c <= 0x7e) ||
		       isUchar(c);
	}

	/**
	 * Checks if a code point is dtext: printable ASCII except
	 * {@code [}, {@code ]} and {@code \}.
	 * @param c the code point to check
	 * @return true if the code point may appear in a domain-literal
	 */
	public static boolean isDtextChar(int c) {
		return (c >= 0x21 && c <= 0x5a) || (c >= 0x5e && c <= 0x7e);
	}

	/**
	 * Checks if a code point is one of the RFC 5322 specials, the
	 * characters that terminate an atom.
	 * @param c the code point to check
	 * @return true if the code point is a special
	 */
	public static boolean isSpecial(int c) {
		switch (c) {
			case '(': case ')': case '<': case '>': case '[': case ']':
			case ':': case ';': case '@': case '\\': case ',': case '.':
			case '"':
				return true;
			default:
				return false;
		}
	}

	// -- Token recognizers --

	/**
	 * Checks if a string is an atom: one or more atext code points.
	 * @param s the string to check
	 * @return true if the string is a non-empty run of atext, false if null
	 */
	public static boolean isAtom(String s) {
		if (s == null || s.isEmpty()) {
			return false;
		}
		for (int i = 0; i < s.length(); ) {
			int c = s.codePointAt(i);
			if (!isAtext(c)) {
				return false;
			}
			i += Character.charCount(c);
		}
		return true;
	}

	/**
	 * Checks if a string is dot-atom-text: atoms joined by single dots.
	 * The empty string, and strings with a leading, trailing or doubled
	 * dot, are rejected.
	 * @param s the string to check
	 * @return true if the string is dot-atom-text, false if null
	 */
	public static boolean isDotAtomText(String s) {
		if (s == null) {
			return false;
		}
		int atomLength = 0;
		for (int i = 0; i < s.length(); ) {
			int c = s.codePointAt(i);
			if (c == DOT) {
				if (atomLength == 0) {
					return false;
				}
				atomLength = 0;
			} else if (isAtext(c)) {
				atomLength++;
			} else {
				return false;
			}
			i += Character.charCount(c);
		}
		return atomLength > 0;
	}

	/**
	 * Checks if a string is a sequence of qcontent and WSP, the body of a
	 * quoted-string without its enclosing quotes. A backslash must be
	 * followed by a VCHAR, and the pair is consumed as a quoted-pair.
	 * The empty string is accepted.
	 * @param s the string to check
	 * @return true if every code point is consumed, false if null
	 */
	public static boolean isQcontent(String s) {
		if (s == null) {
			return false;
		}
		int len = s.length();
		for (int i = 0; i < len; ) {
			int c = s.codePointAt(i);
			i += Character.charCount(c);
			if (c == ESC) {
				if (i >= len) {
					return false;
				}
				int c2 = s.codePointAt(i);
				if (!isVchar(c2)) {
					return false;
				}
				i += Character.charCount(c2);
			} else if (!(isWsp(c) || isQtextChar(c))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Checks if a string is the body of a domain-literal without its
	 * brackets, that is every code point is dtext. The empty string is
	 * accepted. No IPv4 or IPv6 address structure is checked.
	 * @param s the string to check
	 * @return true if every code point is dtext, false if null
	 */
	public static boolean isDtext(String s) {
		if (s == null) {
			return false;
		}
		for (int i = 0; i < s.length(); ) {
			int c = s.codePointAt(i);
			if (!isDtextChar(c)) {
				return false;
			}
			i += Character.charCount(c);
		}
		return true;
	}

}
