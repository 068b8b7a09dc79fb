/**
 * Internet email address validation module.
 *
 * <p>Validates and represents RFC 5322 addr-spec email addresses, including
 * the RFC 6531/6532 internationalized forms. The main entry point is
 * {@link org.bluezoo.addrspec.EmailAddressParser}.
 *
 * <h2>Zero Dependencies</h2>
 *
 * <p>The module depends only on the JDK. Messages are read from the
 * package's L10N resource bundle and diagnostics go to java.util.logging.
 *
 * @see org.bluezoo.addrspec.EmailAddressParser
 * @see org.bluezoo.addrspec.EmailAddress
 */
module org.bluezoo.addrspec {
    requires java.logging;

    exports org.bluezoo.addrspec;
}
