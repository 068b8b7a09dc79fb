/*
 * package-info.java
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

/**
 * Validation and representation of Internet email addresses.
 *
 * <p>This package implements the RFC 5322 addr-spec production, with the
 * RFC 6531/6532 extensions for internationalized (UTF-8) addresses and the
 * quoting rules of RFC 3696.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.addrspec.EmailAddressParser} - Validates
 *       addresses, local-parts and domains</li>
 *   <li>{@link org.bluezoo.addrspec.EmailAddress} - An immutable, validated
 *       address</li>
 *   <li>{@link org.bluezoo.addrspec.AddressError} - The reason an address
 *       was rejected</li>
 *   <li>{@link org.bluezoo.addrspec.AddrSpecSyntax} - Character classes and
 *       token recognizers</li>
 *   <li>{@link org.bluezoo.addrspec.MailtoEncoder} - Encodes addresses for
 *       mailto URIs</li>
 * </ul>
 *
 * <h2>Address Format</h2>
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>Dot-atom addresses: user.name+tag@example.com</li>
 *   <li>Quoted local-parts: "john..doe"@example.org</li>
 *   <li>Domain-literals: jsmith@[192.168.2.1]</li>
 *   <li>Internationalized addresses: 用户@例子.广告</li>
 *   <li>Any of the above enclosed in angle brackets</li>
 * </ul>
 *
 * <p>Display names, comments, folding whitespace and the obsolete
 * RFC 5322 syntax are not supported.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * EmailAddress addr = EmailAddressParser.parse("johnstonsk@gmail.com");
 * addr.toURI();                       // mailto:johnstonsk%40gmail.com
 * addr.toDisplay("Simon Johnston");   // Simon Johnston &lt;johnstonsk@gmail.com&gt;
 * </pre>
 *
 * @see <a href="https://tools.ietf.org/html/rfc5322">RFC 5322</a>
 * @see <a href="https://tools.ietf.org/html/rfc6532">RFC 6532</a>
 */
package org.bluezoo.addrspec;
