/*
 * AddrSpecSyntaxTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link AddrSpecSyntax}.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AddrSpecSyntaxTest {

    // ========== Character class tests ==========

    @Test
    public void testIsAtextAlphanumeric() {
        assertTrue(AddrSpecSyntax.isAtext('a'));
        assertTrue(AddrSpecSyntax.isAtext('z'));
        assertTrue(AddrSpecSyntax.isAtext('A'));
        assertTrue(AddrSpecSyntax.isAtext('Z'));
        assertTrue(AddrSpecSyntax.isAtext('0'));
        assertTrue(AddrSpecSyntax.isAtext('9'));
    }

    @Test
    public void testIsAtextPunctuation() {
        String allowed = "!#$%&'*+-/=?^_`{|}~";
        for (int i = 0; i < allowed.length(); i++) {
            assertTrue("atext: " + allowed.charAt(i), AddrSpecSyntax.isAtext(allowed.charAt(i)));
        }
    }

    @Test
    public void testIsAtextRejectsSpecialsAndControls() {
        String specials = "()<>[]:;@\\,.\"";
        for (int i = 0; i < specials.length(); i++) {
            assertFalse("special: " + specials.charAt(i), AddrSpecSyntax.isAtext(specials.charAt(i)));
        }
        assertFalse(AddrSpecSyntax.isAtext(' '));
        assertFalse(AddrSpecSyntax.isAtext('\t'));
        assertFalse(AddrSpecSyntax.isAtext(0x00));
        assertFalse(AddrSpecSyntax.isAtext(0x7f));
    }

    @Test
    public void testIsAtextUnicode() {
        assertTrue(AddrSpecSyntax.isAtext(0x80));
        assertTrue(AddrSpecSyntax.isAtext('ö'));
        assertTrue(AddrSpecSyntax.isAtext('用'));
        assertTrue(AddrSpecSyntax.isAtext(0x1d49c)); // outside the BMP
    }

    @Test
    public void testIsUchar() {
        assertFalse(AddrSpecSyntax.isUchar(0x00));
        assertFalse(AddrSpecSyntax.isUchar(0x7f));
        assertTrue(AddrSpecSyntax.isUchar(0x80));
        assertTrue(AddrSpecSyntax.isUchar(0xffff));
        assertTrue(AddrSpecSyntax.isUchar(0x10ffff));
    }

    @Test
    public void testIsUcharRejectsSurrogates() {
        assertTrue(AddrSpecSyntax.isUchar(0xd7ff));
        assertFalse(AddrSpecSyntax.isUchar(0xd800));
        assertFalse(AddrSpecSyntax.isUchar(0xdbff));
        assertFalse(AddrSpecSyntax.isUchar(0xdc00));
        assertFalse(AddrSpecSyntax.isUchar(0xdfff));
        assertTrue(AddrSpecSyntax.isUchar(0xe000));
        assertFalse(AddrSpecSyntax.isAtext(0xd800));
        assertFalse(AddrSpecSyntax.isQtextChar(0xdc00));
    }

    @Test
    public void testLoneSurrogatesInRecognizers() {
        assertFalse(AddrSpecSyntax.isAtom("a\uD800"));
        assertFalse(AddrSpecSyntax.isDotAtomText("\uDC00.b"));
        assertFalse(AddrSpecSyntax.isQcontent("a \uD800"));
        // reversed pair: two unpaired surrogates
        assertFalse(AddrSpecSyntax.isAtom("\uDC00\uD800"));
        assertTrue(AddrSpecSyntax.isAtom("\uD835\uDC9C"));
    }

    @Test
    public void testIsVchar() {
        assertFalse(AddrSpecSyntax.isVchar(0x20));
        assertTrue(AddrSpecSyntax.isVchar(0x21));
        assertTrue(AddrSpecSyntax.isVchar('"'));
        assertTrue(AddrSpecSyntax.isVchar('\\'));
        assertTrue(AddrSpecSyntax.isVchar(0x7e));
        assertFalse(AddrSpecSyntax.isVchar(0x7f));
        // VCHAR is not extended to non-ASCII here
        assertFalse(AddrSpecSyntax.isVchar(0x80));
    }

    @Test
    public void testIsWsp() {
        assertTrue(AddrSpecSyntax.isWsp(' '));
        assertTrue(AddrSpecSyntax.isWsp('\t'));
        assertFalse(AddrSpecSyntax.isWsp('\r'));
        assertFalse(AddrSpecSyntax.isWsp('\n'));
        assertFalse(AddrSpecSyntax.isWsp('a'));
    }

    @Test
    public void testIsQtextChar() {
        assertTrue(AddrSpecSyntax.isQtextChar(0x21));
        assertFalse(AddrSpecSyntax.isQtextChar('"'));
        assertTrue(AddrSpecSyntax.isQtextChar(0x23));
        assertTrue(AddrSpecSyntax.isQtextChar('@'));
        assertTrue(AddrSpecSyntax.isQtextChar(0x5b));
        assertFalse(AddrSpecSyntax.isQtextChar('\\'));
        assertTrue(AddrSpecSyntax.isQtextChar(0x5d));
        assertTrue(AddrSpecSyntax.isQtextChar(0x7e));
        assertFalse(AddrSpecSyntax.isQtextChar(0x7f));
        assertFalse(AddrSpecSyntax.isQtextChar(' '));
        assertTrue(AddrSpecSyntax.isQtextChar('用'));
    }

    @Test
    public void testIsDtextChar() {
        assertTrue(AddrSpecSyntax.isDtextChar(0x21));
        assertTrue(AddrSpecSyntax.isDtextChar(':'));
        assertTrue(AddrSpecSyntax.isDtextChar(0x5a));
        assertFalse(AddrSpecSyntax.isDtextChar('['));
        assertFalse(AddrSpecSyntax.isDtextChar('\\'));
        assertFalse(AddrSpecSyntax.isDtextChar(']'));
        assertTrue(AddrSpecSyntax.isDtextChar(0x5e));
        assertTrue(AddrSpecSyntax.isDtextChar(0x7e));
        assertFalse(AddrSpecSyntax.isDtextChar(' '));
        assertFalse(AddrSpecSyntax.isDtextChar(0x7f));
        assertFalse(AddrSpecSyntax.isDtextChar(0x80));
    }

    @Test
    public void testIsSpecial() {
        String specials = "()<>[]:;@\\,.\"";
        for (int i = 0; i < specials.length(); i++) {
            assertTrue(AddrSpecSyntax.isSpecial(specials.charAt(i)));
        }
        assertFalse(AddrSpecSyntax.isSpecial('a'));
        assertFalse(AddrSpecSyntax.isSpecial('+'));
        assertFalse(AddrSpecSyntax.isSpecial(' '));
    }

    // ========== Token recognizer tests ==========

    @Test
    public void testIsAtom() {
        assertTrue(AddrSpecSyntax.isAtom("abc"));
        assertTrue(AddrSpecSyntax.isAtom("user+tag"));
        assertTrue(AddrSpecSyntax.isAtom("用户"));
        assertFalse(AddrSpecSyntax.isAtom(""));
        assertFalse(AddrSpecSyntax.isAtom("a.b"));
        assertFalse(AddrSpecSyntax.isAtom("a b"));
        assertFalse(AddrSpecSyntax.isAtom(null));
    }

    @Test
    public void testIsDotAtomTextValid() {
        assertTrue(AddrSpecSyntax.isDotAtomText("a"));
        assertTrue(AddrSpecSyntax.isDotAtomText("a.b.c"));
        assertTrue(AddrSpecSyntax.isDotAtomText("user.name+tag"));
        assertTrue(AddrSpecSyntax.isDotAtomText("例子.广告"));
        assertTrue(AddrSpecSyntax.isDotAtomText("𝒜.b"));
    }

    @Test
    public void testIsDotAtomTextEmptySegments() {
        assertFalse(AddrSpecSyntax.isDotAtomText(""));
        assertFalse(AddrSpecSyntax.isDotAtomText("."));
        assertFalse(AddrSpecSyntax.isDotAtomText(".a"));
        assertFalse(AddrSpecSyntax.isDotAtomText("a."));
        assertFalse(AddrSpecSyntax.isDotAtomText("a..b"));
    }

    @Test
    public void testIsDotAtomTextInvalidCharacters() {
        assertFalse(AddrSpecSyntax.isDotAtomText("a b"));
        assertFalse(AddrSpecSyntax.isDotAtomText("a\"b"));
        assertFalse(AddrSpecSyntax.isDotAtomText("a@b"));
        assertFalse(AddrSpecSyntax.isDotAtomText(null));
    }

    @Test
    public void testIsQcontentPlain() {
        assertTrue(AddrSpecSyntax.isQcontent(""));
        assertTrue(AddrSpecSyntax.isQcontent("john..doe"));
        assertTrue(AddrSpecSyntax.isQcontent("Abc@def"));
        assertTrue(AddrSpecSyntax.isQcontent(" "));
        assertTrue(AddrSpecSyntax.isQcontent("a\tb"));
        assertTrue(AddrSpecSyntax.isQcontent("用 户"));
    }

    @Test
    public void testIsQcontentQuotedPair() {
        assertTrue(AddrSpecSyntax.isQcontent("\\\""));
        assertTrue(AddrSpecSyntax.isQcontent("\\\\"));
        assertTrue(AddrSpecSyntax.isQcontent("Joe.\\\\Blow"));
        assertTrue(AddrSpecSyntax.isQcontent("a\\bc"));
    }

    @Test
    public void testIsQcontentInvalid() {
        // bare quote and backslash
        assertFalse(AddrSpecSyntax.isQcontent("a\"b"));
        assertFalse(AddrSpecSyntax.isQcontent("\\"));
        assertFalse(AddrSpecSyntax.isQcontent("ab\\"));
        // only VCHAR may follow the backslash
        assertFalse(AddrSpecSyntax.isQcontent("\\ "));
        assertFalse(AddrSpecSyntax.isQcontent("\\用"));
        // control characters
        assertFalse(AddrSpecSyntax.isQcontent("a\nb"));
        assertFalse(AddrSpecSyntax.isQcontent("a\rb"));
        assertFalse(AddrSpecSyntax.isQcontent(null));
    }

    @Test
    public void testIsDtext() {
        assertTrue(AddrSpecSyntax.isDtext(""));
        assertTrue(AddrSpecSyntax.isDtext("192.168.2.1"));
        assertTrue(AddrSpecSyntax.isDtext("IPv6:2001:db8::1"));
        assertTrue(AddrSpecSyntax.isDtext("not-an-ip"));
        assertFalse(AddrSpecSyntax.isDtext("a[b"));
        assertFalse(AddrSpecSyntax.isDtext("a]b"));
        assertFalse(AddrSpecSyntax.isDtext("a\\b"));
        assertFalse(AddrSpecSyntax.isDtext("a b"));
        assertFalse(AddrSpecSyntax.isDtext("例子"));
        assertFalse(AddrSpecSyntax.isDtext(null));
    }

}
