package com.parkthrive.crmops.resolve;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailingAddressParserTest {

    private final MailingAddressParser parser = new MailingAddressParser("US");

    @Test
    void testParse_StreetCityStateZip() {
        MailingAddress address = parser.parse("12 Main St, Austin, TX 78701");

        assertEquals("12 Main St", address.getAddressLine1());
        assertEquals("Austin", address.getCity());
        assertEquals("TX", address.getState());
        assertEquals("78701", address.getPostalCode());
        assertEquals("US", address.getCountryCode());
    }

    @Test
    void testParse_StateWithoutZip() {
        MailingAddress address = parser.parse("12 Main St, Austin, TX");

        assertEquals("TX", address.getState());
        assertEquals("", address.getPostalCode());
    }

    @Test
    void testParse_TwoParts() {
        MailingAddress address = parser.parse("PO Box 9, Dallas");

        assertEquals("PO Box 9", address.getAddressLine1());
        assertEquals("Dallas", address.getCity());
        assertEquals("", address.getState());
    }

    @Test
    void testParse_SinglePartIsStreet() {
        assertEquals("General Delivery", parser.parse("General Delivery").getAddressLine1());
    }

    @Test
    void testParse_BlankIsEmpty() {
        assertTrue(parser.parse("  ").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
