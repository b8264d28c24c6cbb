package dev.pekelund.efactura.invoiceparser;

/**
 * UBL 2.1 tags read by the invoice parser.
 */
final class UblTags {

    static final UblTag ACCOUNTING_SUPPLIER_PARTY = UblTag.cac("AccountingSupplierParty");
    static final UblTag ACCOUNTING_CUSTOMER_PARTY = UblTag.cac("AccountingCustomerParty");
    static final UblTag PARTY = UblTag.cac("Party");
    static final UblTag PARTY_LEGAL_ENTITY = UblTag.cac("PartyLegalEntity");
    static final UblTag PARTY_NAME = UblTag.cac("PartyName");
    static final UblTag PARTY_TAX_SCHEME = UblTag.cac("PartyTaxScheme");
    static final UblTag TAX_SCHEME = UblTag.cac("TaxScheme");
    static final UblTag LEGAL_MONETARY_TOTAL = UblTag.cac("LegalMonetaryTotal");
    static final UblTag INVOICE_LINE = UblTag.cac("InvoiceLine");
    static final UblTag CREDIT_NOTE_LINE = UblTag.cac("CreditNoteLine");
    static final UblTag ITEM = UblTag.cac("Item");
    static final UblTag PRICE = UblTag.cac("Price");
    static final UblTag CLASSIFIED_TAX_CATEGORY = UblTag.cac("ClassifiedTaxCategory");

    static final UblTag ID = UblTag.cbc("ID");
    static final UblTag NAME = UblTag.cbc("Name");
    static final UblTag DESCRIPTION = UblTag.cbc("Description");
    static final UblTag REGISTRATION_NAME = UblTag.cbc("RegistrationName");
    static final UblTag COMPANY_ID = UblTag.cbc("CompanyID");
    static final UblTag ISSUE_DATE = UblTag.cbc("IssueDate");
    static final UblTag DUE_DATE = UblTag.cbc("DueDate");
    static final UblTag DOCUMENT_CURRENCY_CODE = UblTag.cbc("DocumentCurrencyCode");
    static final UblTag PAYABLE_AMOUNT = UblTag.cbc("PayableAmount");
    static final UblTag TAX_INCLUSIVE_AMOUNT = UblTag.cbc("TaxInclusiveAmount");
    static final UblTag TAX_EXCLUSIVE_AMOUNT = UblTag.cbc("TaxExclusiveAmount");
    static final UblTag LINE_EXTENSION_AMOUNT = UblTag.cbc("LineExtensionAmount");
    static final UblTag INVOICED_QUANTITY = UblTag.cbc("InvoicedQuantity");
    static final UblTag CREDITED_QUANTITY = UblTag.cbc("CreditedQuantity");
    static final UblTag PRICE_AMOUNT = UblTag.cbc("PriceAmount");
    static final UblTag PERCENT = UblTag.cbc("Percent");

    static final String CURRENCY_ATTRIBUTE = "currencyID";
    static final String UNIT_ATTRIBUTE = "unitCode";

    private UblTags() {
    }
}
