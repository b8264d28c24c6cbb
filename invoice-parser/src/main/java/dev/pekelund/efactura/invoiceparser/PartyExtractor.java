package dev.pekelund.efactura.invoiceparser;

import static dev.pekelund.efactura.invoiceparser.UblTags.COMPANY_ID;
import static dev.pekelund.efactura.invoiceparser.UblTags.ID;
import static dev.pekelund.efactura.invoiceparser.UblTags.NAME;
import static dev.pekelund.efactura.invoiceparser.UblTags.PARTY;
import static dev.pekelund.efactura.invoiceparser.UblTags.PARTY_LEGAL_ENTITY;
import static dev.pekelund.efactura.invoiceparser.UblTags.PARTY_NAME;
import static dev.pekelund.efactura.invoiceparser.UblTags.PARTY_TAX_SCHEME;
import static dev.pekelund.efactura.invoiceparser.UblTags.REGISTRATION_NAME;
import static dev.pekelund.efactura.invoiceparser.UblTags.TAX_SCHEME;

import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Resolves issuer and recipient parties. Both sides use the same rules.
 */
final class PartyExtractor {

    private static final String VAT_SCHEME = "VAT";

    private PartyExtractor() {
    }

    static InvoiceParty extract(Element root, UblTag partyWrapper) {
        Optional<Element> party = UblLookup.element(root,
            UblPath.of(partyWrapper, PARTY),
            UblPath.of(partyWrapper));
        if (party.isEmpty()) {
            return InvoiceParty.empty();
        }
        return new InvoiceParty(name(party.get()), vatId(party.get()));
    }

    private static String name(Element party) {
        return UblLookup.text(party,
            UblPath.of(PARTY_LEGAL_ENTITY, REGISTRATION_NAME),
            UblPath.of(PARTY_NAME, NAME)).orElse(null);
    }

    /**
     * Scheme tagged as VAT wins; otherwise the first scheme that carries a company id.
     */
    private static String vatId(Element party) {
        String firstPresent = null;
        for (Element scheme : UblLookup.children(party, PARTY_TAX_SCHEME)) {
            Optional<String> companyId = UblLookup.text(scheme, UblPath.of(COMPANY_ID));
            if (companyId.isEmpty()) {
                continue;
            }
            String schemeId = UblLookup.text(scheme, UblPath.of(TAX_SCHEME, ID)).orElse(null);
            if (VAT_SCHEME.equalsIgnoreCase(schemeId)) {
                return companyId.get();
            }
            if (firstPresent == null) {
                firstPresent = companyId.get();
            }
        }
        return firstPresent;
    }
}
